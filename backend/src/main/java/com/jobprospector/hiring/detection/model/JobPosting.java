package com.jobprospector.hiring.detection.model;

public record JobPosting(
    String title,
    String location,
    String department,
    String url,
    AtsPlatform platform
) {
    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
