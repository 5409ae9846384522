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

import static com.jobprospector.hiring.detection.util.JsonNodes.text;

@Component
public class GreenhouseBoardClient implements AtsBoardClient {
    private static final Logger log = LoggerFactory.getLogger(GreenhouseBoardClient.class);

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HiringProperties properties;

    public GreenhouseBoardClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, HiringProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public AtsPlatform platform() {
        return AtsPlatform.GREENHOUSE;
    }

    @Override
    public PlatformLookup fetchBoard(String token) {
        String feedUrl = properties.getPlatform().getGreenhouseApiBase() + token + "/jobs";
        log.info("Fetching Greenhouse jobs: {}", feedUrl);
        HttpFetchResult fetch = httpClient.getJson(feedUrl, Duration.ofSeconds(properties.getPlatform().getTimeoutSeconds()));
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("Greenhouse board {} unavailable: {}", token, fetch.failureLabel());
            return fetch.errorCode() != null
                ? PlatformLookup.error(AtsPlatform.GREENHOUSE, token, "greenhouse_" + fetch.errorCode())
                : PlatformLookup.empty(AtsPlatform.GREENHOUSE, token);
        }

        try {
            JsonNode jobs = objectMapper.readTree(fetch.body()).path("jobs");
            if (!jobs.isArray()) {
                return PlatformLookup.error(AtsPlatform.GREENHOUSE, token, "greenhouse_invalid_payload");
            }
            List<JobPosting> postings = new ArrayList<>();
            for (JsonNode job : jobs) {
                JsonNode departments = job.path("departments");
                String department = departments.isArray() && !departments.isEmpty()
                    ? text(departments.get(0), "name")
                    : null;
                postings.add(new JobPosting(
                    text(job, "title"),
                    text(job.path("location"), "name"),
                    department,
                    text(job, "absolute_url"),
                    AtsPlatform.GREENHOUSE
                ));
            }
            log.info("Greenhouse: found {} jobs for {}", postings.size(), token);
            return PlatformLookup.jobs(AtsPlatform.GREENHOUSE, token, postings);
        } catch (Exception e) {
            log.warn("Failed to parse Greenhouse payload for {}", token, e);
            return PlatformLookup.error(AtsPlatform.GREENHOUSE, token, "greenhouse_parse_error");
        }
    }
}
