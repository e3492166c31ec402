package com.mealscout.integrations;

/**
 * A call to an external HTTP service failed after retries.
 */
public class UpstreamException extends RuntimeException {

    private final String service;

    public UpstreamException(String service, String message) {
        super(message);
        this.service = service;
    }

    public UpstreamException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
