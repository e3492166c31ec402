package com.mealscout.service.impl;

import com.mealscout.service.ChatStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class PlaceSummaries {

    static final List<String> FIELDS = List.of(ChatStore.PLACE_ID, "displayName", "editorialSummary");

    private PlaceSummaries() {
    }

    static Map<String, Object> of(Map<String, Object> place) {
        Map<String, Object> summary = new LinkedHashMap<>();
        for (String field : FIELDS) {
            if (place.containsKey(field)) {
                summary.put(field, place.get(field));
            }
        }
        return summary;
    }
}
