package com.jobprospector.hiring.detection.util;

public final class LogText {
    public static final int PREVIEW_LIMIT = 500;

    private LogText() {
    }

    public static String preview(String value) {
        return preview(value, PREVIEW_LIMIT);
    }

    public static String preview(String value, int limit) {
        if (value == null) {
            return "";
        }
        String flat = value.replaceAll("\\s+", " ").trim();
        return flat.length() <= limit ? flat : flat.substring(0, limit) + "...";
    }
}
