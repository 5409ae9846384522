package com.jobprospector.hiring.detection.http;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientTest {
    private static final String DESKTOP_UA = "Mozilla/5.0 (X11; Linux x86_64) TestBrowser/1.0";

    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        HiringProperties properties = new HiringProperties();
        properties.getHttp().setUserAgents(List.of(DESKTOP_UA));
        properties.getHttp().setMaxBodyBytes(1024);
        executor = Executors.newFixedThreadPool(2);
        client = new PoliteHttpClient(properties, executor, new UserAgentRotator(properties));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void pageRequestsCarryRotatedDesktopUserAgent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>careers</html>"));

        HttpFetchResult result = client.getPage(server.url("/careers").toString(), Duration.ofSeconds(5));

        assertThat(result.isOk()).isTrue();
        assertThat(result.body()).contains("careers");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).isEqualTo(DESKTOP_UA);
        assertThat(request.getHeader("Accept")).contains("text/html");
    }

    @Test
    void postJsonSendsBodyAndExtraHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"organic\":[]}"));

        HttpFetchResult result = client.postJson(
            server.url("/search").toString(),
            "{\"q\":\"acme\",\"num\":5}",
            Map.of("X-API-KEY", "secret"),
            Duration.ofSeconds(5)
        );

        assertThat(result.isSuccessful()).isTrue();
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("X-API-KEY")).isEqualTo("secret");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"q\":\"acme\",\"num\":5}");
    }

    @Test
    void headReportsStatusWithoutBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.head(server.url("/jobs").toString(), Duration.ofSeconds(5));

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.errorCode()).isNull();
        assertThat(result.body()).isNull();
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getMethod()).isEqualTo("HEAD");
    }

    @Test
    void bodyIsCappedAtConfiguredSize() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("x".repeat(5000)));

        HttpFetchResult result = client.getPage(server.url("/big").toString(), Duration.ofSeconds(5));

        assertThat(result.body()).hasSize(1024);
    }

    @Test
    void malformedUrlBecomesErrorResult() {
        HttpFetchResult result = client.getPage("https://", Duration.ofSeconds(1));

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.statusCode()).isZero();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void connectionFailureBecomesErrorResult() throws Exception {
        String url = server.url("/gone").toString();
        server.shutdown();

        HttpFetchResult result = client.getPage(url, Duration.ofSeconds(2));

        assertThat(result.errorCode()).isIn("io_error", "timeout");
        assertThat(result.isSuccessful()).isFalse();
    }
}
