package com.mealscout.gateway;

import java.io.IOException;

/**
 * Outbound side of one live connection.
 */
@FunctionalInterface
public interface ConnectionSink {

    void send(String event, Object payload) throws IOException;
}
