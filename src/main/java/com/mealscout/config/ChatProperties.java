package com.mealscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    private Socket socket = new Socket();
    private Store store = new Store();

    @Data
    public static class Socket {
        private String path = "/ws";
        private String token;
        private String allowedOrigins = "*";
        private int sendTimeLimitMs = 15_000;
        private int sendBufferSizeLimit = 512 * 1024;
        private int maxTextMessageSize = 64 * 1024;
    }

    @Data
    public static class Store {
        /**
         * {@code in-memory} or {@code database}.
         */
        private String storage = "in-memory";
    }
}
