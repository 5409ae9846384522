package com.jobprospector.hiring.detection.fetch;

public interface BrowserRenderer {
    String render(String url, String waitSelector);

    boolean isAvailable();
}
