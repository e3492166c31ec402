package com.mealscout.tools;

import java.util.List;
import java.util.Map;

/**
 * Lenient readers for assistant supplied arguments. Numbers may arrive as integers,
 * decimals or numeric strings.
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    public static String string(Map<String, Object> args, String key, String fallback) {
        Object value = args.get(key);
        if (value == null) {
            return fallback;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? fallback : text;
    }

    public static int integer(Map<String, Object> args, String key, int fallback) {
        Object value = args.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return (int) Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Argument '" + key + "' must be a number, got '" + text + "'");
            }
        }
        return fallback;
    }

    public static List<String> strings(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text);
        }
        return List.of();
    }
}
