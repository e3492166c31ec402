package com.mealscout.images;

public record ImageOutcome(int index, String description, String error) {

    public static ImageOutcome success(int index, String description) {
        return new ImageOutcome(index, description, null);
    }

    public static ImageOutcome failure(int index, String error) {
        return new ImageOutcome(index, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * The description, or the error text when the image could not be described.
     */
    public String text() {
        return isSuccess() ? description : error;
    }
}
