package com.mealscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints and keys of the place, review and content search providers.
 */
@Data
@ConfigurationProperties(prefix = "integrations")
public class IntegrationProperties {

    private Google google = new Google();
    private Yelp yelp = new Yelp();
    private Exa exa = new Exa();
    private Client client = new Client();

    @Data
    public static class Google {
        private String apiKey;
        private String searchEndpoint = "https://places.googleapis.com/v1/places:searchText";
        private String placesEndpoint = "https://places.googleapis.com/v1/places";
        private String photosEndpoint = "https://places.googleapis.com/v1";
        private long pageDelayMs = 2_000;
    }

    @Data
    public static class Yelp {
        private String apiKey;
        private String baseUrl = "https://api.yelp.com/v3";
    }

    @Data
    public static class Exa {
        private String apiKey;
        private String baseUrl = "https://api.exa.ai";
    }

    @Data
    public static class Client {
        private long timeoutMs = 20_000;
        private int retryMaxAttempts = 2;
        private long retryBackoffMs = 300;
    }
}
