package com.mealscout.images;

import com.mealscout.config.AiProperties;
import com.mealscout.integrations.PlacesClient;
import com.mealscout.service.ChatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Describes place photos with a vision model, several at a time.
 *
 * <p>A batch never fails as a whole: each task ends as a description or an error at its
 * own index, and tasks still running when the batch timeout expires are cancelled and
 * reported as timed out.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageBatchAnalyzer {

    private final ImageDownloader downloader;
    private final ImageDescriber describer;
    private final ChatStore chatStore;
    private final PlacesClient placesClient;
    private final AiProperties properties;

    public BatchResult describeBatch(List<ImageTask> tasks, Duration timeout) {
        AiProperties.Vision vision = properties.getVision();
        return runBatch(tasks, timeout, vision.getDescribeModel(), vision.getDescribePrompt());
    }

    /**
     * Describes every photo of the place that has no description yet, stores the new
     * descriptions (or error texts) on the place and returns the whole photo list as
     * {@code {googleMapsUri, description, index}} entries.
     *
     * @throws IllegalArgumentException when the place is not cached
     */
    public List<Map<String, Object>> describePlacePhotos(String placeId) {
        Map<String, Object> place = chatStore.findPlace(placeId)
                .orElseThrow(() -> new IllegalArgumentException("No place data found for place_id: " + placeId));

        List<ImageTask> tasks = new ArrayList<>();
        List<Map<String, Object>> photos = photosOf(place);
        for (int idx = 0; idx < photos.size(); idx++) {
            Map<String, Object> photo = photos.get(idx);
            if (StringUtils.hasText(Objects.toString(photo.get("description"), null))) {
                continue;
            }
            Object name = photo.get("name");
            if (name != null) {
                tasks.add(new ImageTask(placesClient.photoMediaUrl(name.toString()), idx, name.toString()));
            }
        }
        log.info("Describing {} of {} photo(s) placeId={}", tasks.size(), photos.size(), placeId);

        List<Map<String, Object>> latest = photos;
        if (!tasks.isEmpty()) {
            BatchResult result = describeBatch(tasks, Duration.ofMillis(properties.getVision().getBatchTimeoutMs()));
            // re-read so concurrent updates to other photos are kept
            latest = chatStore.findPlace(placeId).map(this::photosOf).orElse(photos);
            for (ImageOutcome outcome : result.outcomes()) {
                if (outcome.index() < latest.size()) {
                    latest.get(outcome.index()).put("description", outcome.text());
                }
            }
            chatStore.updatePlaceField(placeId, "photos", latest);
            log.debug("Stored photo descriptions placeId={} described={} failed={}",
                    placeId, result.successCount(), result.failureCount());
        }

        List<Map<String, Object>> response = new ArrayList<>(latest.size());
        for (int idx = 0; idx < latest.size(); idx++) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("googleMapsUri", latest.get(idx).get("googleMapsUri"));
            entry.put("description", latest.get(idx).get("description"));
            entry.put("index", idx);
            response.add(entry);
        }
        return response;
    }

    /**
     * Answers {@code query} about one photo with the larger vision model.
     *
     * @throws IllegalArgumentException for an unknown place, a place without photos or an index out of range
     */
    public String extractImageInfo(String placeId, int imageIndex, String query) {
        Map<String, Object> place = chatStore.findPlace(placeId)
                .orElseThrow(() -> new IllegalArgumentException("Place not found for place_id: " + placeId));
        List<Map<String, Object>> photos = photosOf(place);
        if (photos.isEmpty()) {
            throw new IllegalArgumentException("No photo data found for place_id: " + placeId);
        }
        if (imageIndex < 0 || imageIndex >= photos.size()) {
            throw new IllegalArgumentException("Invalid image index: " + imageIndex);
        }
        Object name = photos.get(imageIndex).get("name");
        if (name == null) {
            throw new IllegalArgumentException("Photo " + imageIndex + " of place_id " + placeId + " has no name");
        }
        log.info("Extracting info from image {} placeId={}", imageIndex, placeId);
        byte[] jpeg = downloader.downloadAsJpeg(placesClient.photoMediaUrl(name.toString()));
        return describer.describe(jpeg, properties.getVision().getExtractModel(), query);
    }

    private BatchResult runBatch(List<ImageTask> tasks, Duration timeout, String model, String prompt) {
        if (tasks.isEmpty()) {
            return new BatchResult(List.of());
        }
        int workers = Math.min(Math.max(1, properties.getVision().getConcurrency()), tasks.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("image-worker-"));
        long timeoutMs = timeout.toMillis();
        try {
            List<Callable<String>> calls = tasks.stream()
                    .map(task -> (Callable<String>) () -> describeOne(task, model, prompt))
                    .toList();
            List<Future<String>> futures;
            try {
                futures = pool.invokeAll(calls, timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Image batch interrupted tasks={}", tasks.size());
                return new BatchResult(tasks.stream()
                        .map(task -> ImageOutcome.failure(task.index(), "Interrupted"))
                        .toList());
            }

            List<ImageOutcome> outcomes = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                outcomes.add(collect(tasks.get(i), futures.get(i), timeoutMs));
            }
            BatchResult result = new BatchResult(outcomes);
            log.info("Image batch finished tasks={} described={} failed={}",
                    tasks.size(), result.successCount(), result.failureCount());
            return result;
        } finally {
            pool.shutdownNow();
        }
    }

    private ImageOutcome collect(ImageTask task, Future<String> future, long timeoutMs) {
        if (future.isCancelled()) {
            log.warn("Image {} timed out after {} ms", task.index(), timeoutMs);
            return ImageOutcome.failure(task.index(), "Timed out after " + timeoutMs + " ms");
        }
        try {
            return ImageOutcome.success(task.index(), future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Error processing image {}: {}", task.index(), cause.getMessage(), cause);
            return ImageOutcome.failure(task.index(),
                    Objects.requireNonNullElse(cause.getMessage(), cause.getClass().getSimpleName()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ImageOutcome.failure(task.index(), "Interrupted");
        }
    }

    private String describeOne(ImageTask task, String model, String prompt) {
        byte[] jpeg = downloader.downloadAsJpeg(task.url());
        String description = describer.describe(jpeg, model, prompt);
        log.debug("Processed image {}: {}", task.index(), abbreviate(description));
        return description;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> photosOf(Map<String, Object> place) {
        List<Map<String, Object>> photos = new ArrayList<>();
        if (place.get("photos") instanceof List<?> list) {
            for (Object element : list) {
                photos.add(element instanceof Map<?, ?> map
                        ? new LinkedHashMap<>((Map<String, Object>) map)
                        : new LinkedHashMap<>());
            }
        }
        return photos;
    }

    private static String abbreviate(String text) {
        return text != null && text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
