package com.jobprospector.hiring.detection.ats;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.http.PoliteHttpClient;
import com.jobprospector.hiring.detection.model.AtsPlatform;
import com.jobprospector.hiring.detection.model.HttpFetchResult;
import com.jobprospector.hiring.detection.model.PlatformLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Ashby boards are client-rendered, so a reachable board only yields its URL for the browser layer.
 */
@Component
public class AshbyBoardClient implements AtsBoardClient {
    private static final Logger log = LoggerFactory.getLogger(AshbyBoardClient.class);

    private final PoliteHttpClient httpClient;
    private final HiringProperties properties;

    public AshbyBoardClient(PoliteHttpClient httpClient, HiringProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public AtsPlatform platform() {
        return AtsPlatform.ASHBY;
    }

    @Override
    public PlatformLookup fetchBoard(String token) {
        String boardUrl = properties.getPlatform().getAshbyBoardBase() + token;
        log.info("Checking Ashby board: {}", boardUrl);
        HttpFetchResult fetch = httpClient.getPage(boardUrl, Duration.ofSeconds(properties.getPlatform().getTimeoutSeconds()));
        if (fetch.isOk()) {
            return PlatformLookup.requiresRendering(AtsPlatform.ASHBY, token, boardUrl);
        }
        return fetch.errorCode() != null
            ? PlatformLookup.error(AtsPlatform.ASHBY, token, "ashby_" + fetch.errorCode())
            : PlatformLookup.empty(AtsPlatform.ASHBY, token);
    }
}
