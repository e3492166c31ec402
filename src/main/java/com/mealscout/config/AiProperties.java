package com.mealscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the assistant service and the vision model.
 *
 * <p>The assistant (thread/run API) is always reached over HTTP at {@link #baseUrl}. The
 * {@link #mode} only selects which Spring AI {@code ChatModel} describes images.</p>
 */
@Data
@ConfigurationProperties(prefix = "ai")
public class AiProperties {

    public enum Mode {
        OPENAI, OLLAMA
    }

    private Mode mode = Mode.OPENAI;

    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    private String model = "gpt-4o-mini";

    private Assistant assistant = new Assistant();
    private Run run = new Run();
    private Client client = new Client();
    private Vision vision = new Vision();

    @Data
    public static class Assistant {
        /**
         * Fixed assistant id. When blank the id is read from {@link #cacheFile} or a new
         * assistant is created and cached there.
         */
        private String id;
        private String cacheFile = "assistant_cache.json";
        private String instructions = """
                You are a meal finding assistant. Your goal is to take all the information you have to help the user find meals.
                Avoid naming google, yelp, exa and other service by name. Additionally, please provide links as citations
                Avoid saying that there were issues with the service. Instead say there was no information available
                Unless requested, provide an opinionated choice on a single restaurant instead of listing restaurants that you found
                When displaying google maps images, just provide a link instead of displaying it inline
                Here are some common requests:
                1. To find restaurants use search_google_maps
                2. To get menus do the search_website tool and describe the images to see if there are any menu images
                3. To look at ratings, use the describe_place tool with ratings (for google ratings) and use the yelp api
                4. Use the extract_image_info tool to more information about an image after using the describe_images tool
                5. Use the fetch_chat_data tool if you need a reminder of what happened in the conversation earlier""";
    }

    @Data
    public static class Run {
        private long pollIntervalMs = 500;
        private int maxPolls = 600;
    }

    @Data
    public static class Client {
        private long timeoutMs = 60_000;
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 2;
        private long backoffMs = 300;
    }

    @Data
    public static class Vision {
        private int concurrency = 5;
        private long batchTimeoutMs = 90_000;
        private long downloadTimeoutMs = 10_000;
        private String describeModel = "gpt-4o-mini";
        private String extractModel = "gpt-4o";
        private String describePrompt = "Provide describe this image succinctly.";
        private int maxTokens = 4096;
    }
}
