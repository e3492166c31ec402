package com.mealscout.assistant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.assistant.dto.AssistantDefinition;
import com.mealscout.config.AiProperties;
import com.mealscout.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AssistantBootstrapTest {

    @TempDir
    Path tempDir;

    private AssistantClient client;
    private AiProperties properties;
    private Path cacheFile;

    @BeforeEach
    void setUp() {
        client = mock(AssistantClient.class);
        properties = new AiProperties();
        cacheFile = tempDir.resolve("assistant_cache.json");
        properties.getAssistant().setCacheFile(cacheFile.toString());
    }

    @Test
    void configuredIdIsUsedAsIs() {
        properties.getAssistant().setId("asst_configured");

        assertThat(bootstrap().assistantId()).isEqualTo("asst_configured");
        verifyNoInteractions(client);
    }

    @Test
    void cachedIdIsReusedWhenServiceKnowsIt() throws Exception {
        Files.writeString(cacheFile, "{\"assistant_id\":\"asst_cached\"}");
        when(client.retrieveAssistant("asst_cached")).thenReturn(Optional.of("asst_cached"));

        assertThat(bootstrap().assistantId()).isEqualTo("asst_cached");
        verify(client, never()).createAssistant(any());
    }

    @Test
    void newAssistantIsCreatedOnceAndCached() throws Exception {
        Files.writeString(cacheFile, "{\"assistant_id\":\"asst_gone\"}");
        when(client.retrieveAssistant("asst_gone")).thenReturn(Optional.empty());
        when(client.createAssistant(any())).thenReturn("asst_new");
        AssistantBootstrap bootstrap = bootstrap();

        assertThat(bootstrap.assistantId()).isEqualTo("asst_new");
        assertThat(bootstrap.assistantId()).isEqualTo("asst_new");

        ArgumentCaptor<AssistantDefinition> definition = ArgumentCaptor.forClass(AssistantDefinition.class);
        verify(client, times(1)).createAssistant(definition.capture());
        assertThat(definition.getValue().name()).isEqualTo("MealScout");
        assertThat(definition.getValue().instructions()).contains("search_google_maps");
        assertThat(Files.readString(cacheFile)).contains("asst_new");
    }

    private AssistantBootstrap bootstrap() {
        return new AssistantBootstrap(client, new ToolRegistry(List.of()), properties, new ObjectMapper());
    }
}
