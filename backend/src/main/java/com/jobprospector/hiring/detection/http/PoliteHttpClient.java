package com.jobprospector.hiring.detection.http;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

@Service
public class PoliteHttpClient {
    static final String API_USER_AGENT = "hiring-signal/0.1";
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final HiringProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final UserAgentRotator userAgents;

    public PoliteHttpClient(
        HiringProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        UserAgentRotator userAgents
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getHttp().getGlobalConcurrency());
        this.userAgents = userAgents;
    }

    public HttpFetchResult getPage(String url, Duration timeout) {
        return get(url, HTML_ACCEPT, timeout);
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout) {
        return send(url, "GET", acceptHeader, null, Map.of(), userAgents.next(), timeout);
    }

    public HttpFetchResult getJson(String url, Duration timeout) {
        return send(url, "GET", "application/json,*/*;q=0.8", null, Map.of(), API_USER_AGENT, timeout);
    }

    public HttpFetchResult head(String url, Duration timeout) {
        return send(url, "HEAD", HTML_ACCEPT, null, Map.of(), userAgents.next(), timeout);
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> headers, Duration timeout) {
        return send(
            url,
            "POST",
            "application/json",
            jsonBody == null ? "" : jsonBody,
            headers == null ? Map.of() : headers,
            API_USER_AGENT,
            timeout
        );
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        Map<String, String> extraHeaders,
        String userAgent,
        Duration timeout
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, method, startedAt, "invalid_url", "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout == null ? Duration.ofSeconds(10) : timeout)
                .header("User-Agent", userAgent)
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.5");
            for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
                builder.header(header.getKey(), header.getValue());
            }
            HttpRequest request;
            if ("POST".equals(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            } else if ("HEAD".equals(method)) {
                request = builder.method("HEAD", HttpRequest.BodyPublishers.noBody()).build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            String responseBody = null;
            try (InputStream stream = response.body()) {
                if (stream != null && !"HEAD".equals(method)) {
                    byte[] bytes = stream.readNBytes(properties.getHttp().getMaxBodyBytes());
                    responseBody = new String(bytes, StandardCharsets.UTF_8);
                }
            }
            return new HttpFetchResult(
                url,
                method,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, method, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, method, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, method, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, method, startedAt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpFetchResult errorResult(String url, String method, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            method,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    static URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
