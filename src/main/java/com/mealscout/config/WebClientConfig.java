package com.mealscout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Configuration
@Slf4j
public class WebClientConfig {

    private static final int IMAGE_BUFFER_BYTES = 16 * 1024 * 1024;

    /**
     * Assistants API (v2). Every request carries the beta header the thread/run endpoints require.
     */
    @Bean
    public WebClient assistantWebClient(AiProperties properties) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader("OpenAI-Beta", "assistants=v2");
        withHeader(builder, HttpHeaders.AUTHORIZATION, bearer(properties.getApiKey()));
        return builder.filter(debugLogging("AI-HTTP")).build();
    }

    @Bean
    public WebClient googlePlacesWebClient(IntegrationProperties properties) {
        WebClient.Builder builder = WebClient.builder();
        withHeader(builder, "X-Goog-Api-Key", properties.getGoogle().getApiKey());
        return builder.filter(debugLogging("PLACES-HTTP")).build();
    }

    @Bean
    public WebClient yelpWebClient(IntegrationProperties properties) {
        WebClient.Builder builder = WebClient.builder().baseUrl(properties.getYelp().getBaseUrl());
        withHeader(builder, HttpHeaders.AUTHORIZATION, bearer(properties.getYelp().getApiKey()));
        return builder.filter(debugLogging("YELP-HTTP")).build();
    }

    @Bean
    public WebClient exaWebClient(IntegrationProperties properties) {
        WebClient.Builder builder = WebClient.builder().baseUrl(properties.getExa().getBaseUrl());
        withHeader(builder, "x-api-key", properties.getExa().getApiKey());
        return builder.filter(debugLogging("EXA-HTTP")).build();
    }

    /**
     * Plain client for downloading photos, with room for full size images in memory.
     */
    @Bean
    public WebClient imageWebClient() {
        return WebClient.builder()
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(IMAGE_BUFFER_BYTES))
                        .build())
                .filter(debugLogging("IMAGE-HTTP"))
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    private static String bearer(String apiKey) {
        return StringUtils.hasText(apiKey) ? "Bearer " + apiKey : null;
    }

    // Attach the header only when a value is configured.
    private static void withHeader(WebClient.Builder builder, String name, String value) {
        if (!StringUtils.hasText(value)) {
            return;
        }
        builder.filter((request, next) -> {
            ClientRequest mutated = ClientRequest.from(request)
                    .headers(headers -> headers.set(name, value))
                    .build();
            return next.exchange(mutated);
        });
    }

    private static ExchangeFilterFunction debugLogging(String tag) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (log.isDebugEnabled()) {
                log.debug("[{}] {} {}", tag, clientRequest.method(), redact(clientRequest.url().toString()));
            }
            return Mono.just(clientRequest);
        });
    }

    private static String redact(String url) {
        return url.replaceAll("([?&]key=)[^&]*", "$1***");
    }
}
