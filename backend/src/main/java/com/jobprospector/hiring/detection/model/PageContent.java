package com.jobprospector.hiring.detection.model;

public record PageContent(String url, String html, String text, FetchMode mode, String errorCode) {

    public static PageContent empty(String url, String errorCode) {
        return new PageContent(url, null, "", FetchMode.NONE, errorCode);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public int textLength() {
        return text == null ? 0 : text.length();
    }
}
