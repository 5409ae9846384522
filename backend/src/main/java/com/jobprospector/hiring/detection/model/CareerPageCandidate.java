package com.jobprospector.hiring.detection.model;

public record CareerPageCandidate(String url, DiscoveryMethod method) {
    private static final CareerPageCandidate NONE = new CareerPageCandidate(null, DiscoveryMethod.NONE);

    public CareerPageCandidate {
        if (url == null || url.isBlank()) {
            url = null;
            method = DiscoveryMethod.NONE;
        } else {
            url = url.trim();
        }
    }

    public static CareerPageCandidate none() {
        return NONE;
    }

    public static CareerPageCandidate of(String url, DiscoveryMethod method) {
        return new CareerPageCandidate(url, method);
    }

    public boolean isFound() {
        return url != null;
    }
}
