package com.mealscout.images;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.config.AiProperties;
import com.mealscout.integrations.PlacesClient;
import com.mealscout.service.impl.InMemoryChatStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ImageBatchAnalyzerTest {

    private InMemoryChatStore chatStore;
    private ImageDownloader downloader;
    private PlacesClient placesClient;
    private AtomicInteger running;
    private AtomicInteger maxRunning;
    private ImageBatchAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        chatStore = new InMemoryChatStore(new ObjectMapper());
        downloader = mock(ImageDownloader.class);
        when(downloader.downloadAsJpeg(anyString()))
                .thenAnswer(invocation -> invocation.getArgument(0, String.class).getBytes(StandardCharsets.UTF_8));
        placesClient = mock(PlacesClient.class);
        when(placesClient.photoMediaUrl(anyString())).thenAnswer(invocation -> "https://img/" + invocation.getArgument(0));
        running = new AtomicInteger();
        maxRunning = new AtomicInteger();

        ImageDescriber describer = (jpeg, model, prompt) -> {
            String url = new String(jpeg, StandardCharsets.UTF_8);
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                if (url.contains("slow")) {
                    Thread.sleep(10_000);
                } else {
                    Thread.sleep(50);
                }
                if (url.contains("bad")) {
                    throw new IllegalStateException("vision model unavailable");
                }
                return "photo of " + url.substring(url.lastIndexOf('/') + 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted");
            } finally {
                running.decrementAndGet();
            }
        };
        analyzer = new ImageBatchAnalyzer(downloader, describer, chatStore, placesClient, new AiProperties());
    }

    @Test
    void oneFailureDoesNotSinkTheBatch() {
        List<ImageTask> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String name = i == 3 ? "bad" : "p" + i;
            tasks.add(new ImageTask("https://img/" + name, i, name));
        }

        BatchResult result = analyzer.describeBatch(tasks, Duration.ofSeconds(10));

        assertThat(result.outcomes()).hasSize(8);
        assertThat(result.outcomes()).extracting(ImageOutcome::index).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.outcomes().get(3).error()).isEqualTo("vision model unavailable");
        assertThat(result.outcomes().get(0).description()).isEqualTo("photo of p0");
        assertThat(maxRunning.get()).isLessThanOrEqualTo(5);
    }

    @Test
    void tasksStillRunningAtTimeoutAreReportedTimedOut() {
        List<ImageTask> tasks = List.of(
                new ImageTask("https://img/fast", 0, "fast"),
                new ImageTask("https://img/slow", 1, "slow"));

        BatchResult result = analyzer.describeBatch(tasks, Duration.ofMillis(500));

        assertThat(result.outcomes()).hasSize(2);
        assertThat(result.outcomes().get(0).isSuccess()).isTrue();
        assertThat(result.outcomes().get(1).error()).isEqualTo("Timed out after 500 ms");
    }

    @Test
    void emptyBatchYieldsNoOutcomes() {
        assertThat(analyzer.describeBatch(List.of(), Duration.ofSeconds(1)).outcomes()).isEmpty();
    }

    @Test
    void describePlacePhotosOnlyDescribesNewPhotosAndStoresResults() {
        chatStore.savePlaces(List.of(Map.of(
                "id", "place-1",
                "photos", List.of(
                        Map.of("name", "old", "googleMapsUri", "https://maps/0", "description", "already known"),
                        Map.of("name", "p1", "googleMapsUri", "https://maps/1"),
                        Map.of("name", "bad", "googleMapsUri", "https://maps/2")))));

        List<Map<String, Object>> photos = analyzer.describePlacePhotos("place-1");

        assertThat(photos).extracting(photo -> photo.get("description"))
                .containsExactly("already known", "photo of p1", "vision model unavailable");
        assertThat(photos).extracting(photo -> photo.get("index")).containsExactly(0, 1, 2);
        assertThat(photos.get(1)).containsEntry("googleMapsUri", "https://maps/1");

        Object stored = chatStore.findPlace("place-1").orElseThrow().get("photos");
        assertThat((List<?>) stored).hasSize(3);
        assertThat(((Map<?, ?>) ((List<?>) stored).get(1)).get("description")).isEqualTo("photo of p1");
    }

    @Test
    void describePlacePhotosRejectsUnknownPlace() {
        assertThatThrownBy(() -> analyzer.describePlacePhotos("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No place data found for place_id: missing");
    }

    @Test
    void extractImageInfoValidatesIndex() {
        chatStore.savePlaces(List.of(Map.of("id", "place-2", "photos", List.of(Map.of("name", "p0")))));

        assertThat(analyzer.extractImageInfo("place-2", 0, "what is on the menu?")).isEqualTo("photo of p0");
        assertThatThrownBy(() -> analyzer.extractImageInfo("place-2", 4, "q"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid image index: 4");
        assertThatThrownBy(() -> analyzer.extractImageInfo("nope", 0, "q"))
                .hasMessage("Place not found for place_id: nope");
    }
}
