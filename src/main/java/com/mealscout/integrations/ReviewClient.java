package com.mealscout.integrations;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ReviewClient {

    /**
     * Best matching business for a name near a coordinate.
     */
    Optional<Map<String, Object>> matchBusiness(String name, double latitude, double longitude);

    List<Map<String, Object>> reviews(String businessId);
}
