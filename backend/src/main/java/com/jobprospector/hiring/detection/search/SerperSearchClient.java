package com.jobprospector.hiring.detection.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.http.PoliteHttpClient;
import com.jobprospector.hiring.detection.model.HttpFetchResult;
import com.jobprospector.hiring.detection.model.SearchHit;
import com.jobprospector.hiring.detection.util.LogText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.jobprospector.hiring.detection.util.JsonNodes.text;

@Service
public class SerperSearchClient implements WebSearchClient {
    private static final Logger log = LoggerFactory.getLogger(SerperSearchClient.class);

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HiringProperties.Search config;

    public SerperSearchClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, HiringProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getSearch();
        if (!config.isConfigured()) {
            log.warn("No search API key configured (hiring.search.api-key); search-based discovery is disabled");
        }
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public List<SearchHit> search(String query, int numResults) {
        if (!config.isConfigured() || query == null || query.isBlank()) {
            return List.of();
        }
        String body;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("q", query);
            payload.put("num", Math.max(1, numResults));
            body = objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            log.warn("Could not encode search request for '{}'", query, e);
            return List.of();
        }

        HttpFetchResult fetch = httpClient.postJson(
            config.getEndpoint(),
            body,
            Map.of("X-API-KEY", config.getApiKey()),
            Duration.ofSeconds(config.getTimeoutSeconds())
        );
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.warn("Search failed for '{}': {} {}", query, fetch.failureLabel(), LogText.preview(fetch.body()));
            return List.of();
        }

        try {
            JsonNode organic = objectMapper.readTree(fetch.body()).path("organic");
            if (!organic.isArray()) {
                return List.of();
            }
            List<SearchHit> hits = new ArrayList<>();
            for (JsonNode item : organic) {
                SearchHit hit = new SearchHit(text(item, "title"), text(item, "link"), text(item, "snippet"));
                if (hit.hasLink()) {
                    hits.add(hit);
                }
            }
            log.debug("Search '{}' returned {} results", query, hits.size());
            return hits;
        } catch (Exception e) {
            log.warn("Could not parse search response for '{}': {}", query, LogText.preview(fetch.body()));
            return List.of();
        }
    }
}
