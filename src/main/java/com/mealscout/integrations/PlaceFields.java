package com.mealscout.integrations;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Place detail fields the assistant may ask for, and the ones every search returns.
 */
public final class PlaceFields {

    public static final Set<String> AVAILABLE = Set.of(
            // basic
            "accessibilityOptions", "addressComponents", "adrFormatAddress", "businessStatus",
            "containingPlaces", "displayName", "formattedAddress", "googleMapsLinks", "googleMapsUri",
            "iconBackgroundColor", "iconMaskBaseUri", "location", "photos", "plusCode", "primaryType",
            "primaryTypeDisplayName", "pureServiceAreaBusiness", "shortFormattedAddress",
            "subDestinations", "types", "utcOffsetMinutes", "viewport",
            // advanced
            "currentOpeningHours", "currentSecondaryOpeningHours", "internationalPhoneNumber",
            "nationalPhoneNumber", "priceLevel", "priceRange", "rating", "regularOpeningHours",
            "regularSecondaryOpeningHours", "userRatingCount", "websiteUri",
            // preferred
            "allowsDogs", "curbsidePickup", "delivery", "dineIn", "editorialSummary", "evChargeOptions",
            "fuelOptions", "goodForChildren", "goodForGroups", "goodForWatchingSports", "liveMusic",
            "menuForChildren", "parkingOptions", "paymentOptions", "outdoorSeating", "reservable",
            "restroom", "reviews", "servesBeer", "servesBreakfast", "servesBrunch", "servesCocktails",
            "servesCoffee", "servesDessert", "servesDinner", "servesLunch", "servesVegetarianFood",
            "servesWine", "takeout");

    public static final Set<String> DEFAULT_SEARCH = Set.of(
            "displayName", "id", "formattedAddress", "websiteUri", "location", "photos", "editorialSummary");

    private PlaceFields() {
    }

    /**
     * Fields that can be requested on top of what a search already returned, sorted.
     */
    public static List<String> nonDefault() {
        Set<String> fields = new TreeSet<>(AVAILABLE);
        fields.removeAll(DEFAULT_SEARCH);
        return List.copyOf(fields);
    }

    public static List<String> invalid(Collection<String> requested) {
        return requested.stream()
                .filter(field -> !AVAILABLE.contains(field))
                .toList();
    }

    /**
     * Renders {@code ['a', 'b']}, the list format the assistant was instructed with.
     */
    public static String format(List<String> fields) {
        return fields.stream()
                .map(field -> "'" + field + "'")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
