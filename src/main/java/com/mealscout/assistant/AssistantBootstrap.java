package com.mealscout.assistant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.assistant.dto.AssistantDefinition;
import com.mealscout.config.AiProperties;
import com.mealscout.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the assistant every run is started against, once, on first use.
 *
 * <p>Order: the configured {@code ai.assistant.id}; the id cached in
 * {@code ai.assistant.cache-file} if the service still knows it; otherwise a new assistant
 * is created with the registered tools and its id is written to the cache file.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssistantBootstrap {

    static final String ASSISTANT_NAME = "MealScout";

    private final AssistantClient assistantClient;
    private final ToolRegistry toolRegistry;
    private final AiProperties properties;
    private final ObjectMapper objectMapper;

    private volatile String assistantId;

    public String assistantId() {
        String resolved = assistantId;
        if (resolved == null) {
            synchronized (this) {
                if (assistantId == null) {
                    assistantId = resolve();
                }
                resolved = assistantId;
            }
        }
        return resolved;
    }

    private String resolve() {
        AiProperties.Assistant assistant = properties.getAssistant();
        if (StringUtils.hasText(assistant.getId())) {
            log.info("Using configured assistant id={}", assistant.getId());
            return assistant.getId();
        }

        Path cacheFile = Path.of(assistant.getCacheFile());
        String cached = readCachedId(cacheFile);
        if (cached != null) {
            if (assistantClient.retrieveAssistant(cached).isPresent()) {
                log.info("Loaded cached assistant id={}", cached);
                return cached;
            }
            log.warn("Cached assistant id={} not found by the service; creating a new one", cached);
        }

        log.info("Creating assistant with {} tool(s)", toolRegistry.names().size());
        String created = assistantClient.createAssistant(new AssistantDefinition(
                ASSISTANT_NAME,
                properties.getModel(),
                assistant.getInstructions(),
                toolRegistry.openAiToolsSchema()));
        writeCachedId(cacheFile, created);
        return created;
    }

    private String readCachedId(Path cacheFile) {
        if (!Files.isRegularFile(cacheFile)) {
            return null;
        }
        try {
            JsonNode cache = objectMapper.readTree(cacheFile.toFile());
            String id = cache.path("assistant_id").asText(null);
            return StringUtils.hasText(id) ? id : null;
        } catch (IOException e) {
            log.error("Error reading assistant cache file {}", cacheFile, e);
            return null;
        }
    }

    private void writeCachedId(Path cacheFile, String id) {
        try {
            objectMapper.writeValue(cacheFile.toFile(), Map.of("assistant_id", id));
            log.info("Cached new assistant id={} in {}", id, cacheFile);
        } catch (IOException e) {
            log.error("Error caching assistant id={} in {}", id, cacheFile, e);
        }
    }
}
