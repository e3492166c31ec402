package com.mealscout.gateway;

import java.util.Map;

/**
 * Human readable progress labels shown to clients instead of tool names.
 */
public final class ToolLabels {

    static final String FALLBACK = "Working on your request";

    private static final Map<String, String> LABELS = Map.of(
            "search_google_maps", "Searching Google Maps",
            "describe_images", "Analyzing images from Google Maps",
            "extract_image_info", "Extracting information from Google Maps images",
            "fetch_chat_data", "Recollecting information from historical chat data",
            "describe_place", "Getting more information from Google Maps",
            "get_stored_places_for_chat", "Retrieving all the places we have talked about",
            "get_yelp_reviews", "Fetching Yelp reviews",
            "get_user_location", "Getting your location",
            "search_website", "Searching website content");

    private ToolLabels() {
    }

    public static String labelFor(String toolName) {
        return toolName == null ? FALLBACK : LABELS.getOrDefault(toolName, FALLBACK);
    }
}
