package com.jobprospector.hiring.detection.service;

public class TransientDetectionException extends RuntimeException {
    private final String careerPageUrl;

    public TransientDetectionException(String careerPageUrl, String message) {
        super(message);
        this.careerPageUrl = careerPageUrl;
    }

    public String careerPageUrl() {
        return careerPageUrl;
    }
}
