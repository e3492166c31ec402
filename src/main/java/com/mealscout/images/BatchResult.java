package com.mealscout.images;

import java.util.List;

/**
 * Exactly one outcome per submitted task, in submission order.
 */
public record BatchResult(List<ImageOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public long successCount() {
        return outcomes.stream().filter(ImageOutcome::isSuccess).count();
    }

    public long failureCount() {
        return outcomes.size() - successCount();
    }
}
