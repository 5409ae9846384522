package com.jobprospector.hiring.detection.model;

public record SearchHit(String title, String link, String snippet) {
    public boolean hasLink() {
        return link != null && !link.isBlank();
    }
}
