package com.mealscout.model;

public record GeoLocation(Double latitude, Double longitude) {

    public boolean isComplete() {
        return latitude != null && longitude != null;
    }
}
