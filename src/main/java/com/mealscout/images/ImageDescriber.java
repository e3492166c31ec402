package com.mealscout.images;

public interface ImageDescriber {

    /**
     * Asks a vision model about a JPEG image.
     */
    String describe(byte[] jpeg, String model, String prompt);
}
