package com.jobprospector.hiring.detection.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.http.PoliteHttpClient;
import com.jobprospector.hiring.detection.model.SearchHit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.jobprospector.hiring.detection.FetchResults.ok;
import static com.jobprospector.hiring.detection.FetchResults.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SerperSearchClientTest {
    private static final String ENDPOINT = "https://google.serper.dev/search";

    @Mock private PoliteHttpClient httpClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SerperSearchClient client(String apiKey) {
        HiringProperties properties = new HiringProperties();
        properties.getSearch().setApiKey(apiKey);
        return new SerperSearchClient(httpClient, objectMapper, properties);
    }

    @Test
    void readsOrganicResultsInOrder() throws Exception {
        when(httpClient.postJson(eq(ENDPOINT), anyString(), anyMap(), any(Duration.class))).thenReturn(ok(ENDPOINT, """
            {"organic": [
              {"title": "Careers at Acme", "link": "https://acme.com/careers", "snippet": "Join us"},
              {"title": "No link"},
              {"title": "Acme jobs", "link": "https://jobs.lever.co/acme"}
            ]}
            """));

        List<SearchHit> hits = client("key-1").search("site:acme.com (careers OR jobs)", 5);

        assertThat(hits).extracting(SearchHit::link)
            .containsExactly("https://acme.com/careers", "https://jobs.lever.co/acme");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(httpClient).postJson(eq(ENDPOINT), body.capture(), headers.capture(), any(Duration.class));
        assertThat(headers.getValue()).containsEntry("X-API-KEY", "key-1");
        JsonNode payload = objectMapper.readTree(body.getValue());
        assertThat(payload.path("q").asText()).isEqualTo("site:acme.com (careers OR jobs)");
        assertThat(payload.path("num").asInt()).isEqualTo(5);
    }

    @Test
    void missingKeyShortCircuits() {
        SerperSearchClient client = client("");

        assertThat(client.isConfigured()).isFalse();
        assertThat(client.search("anything", 5)).isEmpty();
        verifyNoInteractions(httpClient);
    }

    @Test
    void upstreamFailureYieldsNoResults() {
        when(httpClient.postJson(eq(ENDPOINT), anyString(), anyMap(), any(Duration.class)))
            .thenReturn(status(ENDPOINT, 403, "{\"message\":\"Unauthorized\"}"));

        assertThat(client("bad-key").search("acme", 5)).isEmpty();
    }
}
