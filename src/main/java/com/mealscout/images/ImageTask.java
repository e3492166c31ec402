package com.mealscout.images;

/**
 * One photo to describe. {@code index} is the photo's position in the place's photo list.
 */
public record ImageTask(String url, int index, String name) {
}
