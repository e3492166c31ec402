package com.mealscout.integrations;

import com.mealscout.model.GeoLocation;

/**
 * A text search, optionally biased to a circle around {@code location}.
 *
 * @param page zero based page to return; earlier pages are walked through their page tokens
 */
public record PlaceSearch(String query, GeoLocation location, int radius, int limit, int page) {

    public static final int DEFAULT_RADIUS = 5000;
    public static final int DEFAULT_LIMIT = 5;
    public static final int MAX_RADIUS = 50_000;
    public static final int MAX_LIMIT = 20;

    public int clampedRadius() {
        return Math.min(Math.max(0, radius), MAX_RADIUS);
    }

    public int clampedLimit() {
        return Math.min(Math.max(1, limit), MAX_LIMIT);
    }
}
