package com.jobprospector.hiring.detection;

import com.jobprospector.hiring.detection.model.HttpFetchResult;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public final class FetchResults {
    private FetchResults() {
    }

    public static HttpFetchResult ok(String url, String body) {
        return status(url, 200, body);
    }

    public static HttpFetchResult status(String url, int statusCode, String body) {
        return new HttpFetchResult(
            url,
            "GET",
            URI.create(url),
            statusCode,
            body,
            "text/html",
            Instant.now(),
            Duration.ofMillis(5),
            null,
            null
        );
    }

    public static HttpFetchResult error(String url, String errorCode) {
        return new HttpFetchResult(url, "GET", null, 0, null, null, Instant.now(), Duration.ZERO, errorCode, errorCode);
    }
}
