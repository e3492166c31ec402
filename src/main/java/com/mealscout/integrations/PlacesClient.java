package com.mealscout.integrations;

import java.util.List;
import java.util.Map;

public interface PlacesClient {

    List<Map<String, Object>> searchText(PlaceSearch search);

    Map<String, Object> details(String placeId, List<String> fields);

    String photoMediaUrl(String photoName);
}
