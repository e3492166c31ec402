package com.mealscout.integrations;

import java.util.List;

public interface ContentSearchClient {

    /**
     * Text of the pages of {@code domain} matching {@code query}. Results without text are skipped.
     */
    List<String> searchDomain(String domain, String query);
}
