package com.jobprospector.hiring.detection.ats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.http.PoliteHttpClient;
import com.jobprospector.hiring.detection.model.AtsPlatform;
import com.jobprospector.hiring.detection.model.HttpFetchResult;
import com.jobprospector.hiring.detection.model.JobPosting;
import com.jobprospector.hiring.detection.model.PlatformLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.jobprospector.hiring.detection.util.JsonNodes.firstNonBlank;
import static com.jobprospector.hiring.detection.util.JsonNodes.text;

@Component
public class LeverBoardClient implements AtsBoardClient {
    private static final Logger log = LoggerFactory.getLogger(LeverBoardClient.class);

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HiringProperties properties;

    public LeverBoardClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, HiringProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public AtsPlatform platform() {
        return AtsPlatform.LEVER;
    }

    @Override
    public PlatformLookup fetchBoard(String token) {
        String feedUrl = properties.getPlatform().getLeverApiBase() + token + "?mode=json";
        log.info("Fetching Lever jobs: {}", feedUrl);
        HttpFetchResult fetch = httpClient.getJson(feedUrl, Duration.ofSeconds(properties.getPlatform().getTimeoutSeconds()));
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("Lever board {} unavailable: {}", token, fetch.failureLabel());
            return fetch.errorCode() != null
                ? PlatformLookup.error(AtsPlatform.LEVER, token, "lever_" + fetch.errorCode())
                : PlatformLookup.empty(AtsPlatform.LEVER, token);
        }

        try {
            JsonNode root = objectMapper.readTree(fetch.body());
            if (!root.isArray()) {
                return PlatformLookup.error(AtsPlatform.LEVER, token, "lever_invalid_payload");
            }
            List<JobPosting> postings = new ArrayList<>();
            for (JsonNode job : root) {
                JsonNode categories = job.path("categories");
                postings.add(new JobPosting(
                    text(job, "text"),
                    text(categories, "location"),
                    text(categories, "team"),
                    firstNonBlank(text(job, "hostedUrl"), text(job, "applyUrl")),
                    AtsPlatform.LEVER
                ));
            }
            log.info("Lever: found {} jobs for {}", postings.size(), token);
            return PlatformLookup.jobs(AtsPlatform.LEVER, token, postings);
        } catch (Exception e) {
            log.warn("Failed to parse Lever payload for {}", token, e);
            return PlatformLookup.error(AtsPlatform.LEVER, token, "lever_parse_error");
        }
    }
}
