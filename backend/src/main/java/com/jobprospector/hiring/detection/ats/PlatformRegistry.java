package com.jobprospector.hiring.detection.ats;

import com.jobprospector.hiring.detection.model.AtsPlatform;
import com.jobprospector.hiring.detection.model.PlatformLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class PlatformRegistry {
    private static final Logger log = LoggerFactory.getLogger(PlatformRegistry.class);
    static final List<AtsPlatform> PROBE_ORDER = List.of(AtsPlatform.GREENHOUSE, AtsPlatform.LEVER, AtsPlatform.ASHBY);

    private final Map<AtsPlatform, AtsBoardClient> clients = new EnumMap<>(AtsPlatform.class);

    public PlatformRegistry(List<AtsBoardClient> boardClients) {
        for (AtsBoardClient client : boardClients) {
            clients.put(client.platform(), client);
        }
    }

    public AtsPlatform detectPlatform(String url) {
        return AtsPlatform.fromUrl(url);
    }

    public String extractCompanyToken(String url) {
        return CompanyTokenExtractor.extract(url);
    }

    public PlatformLookup lookup(AtsPlatform platform, String token) {
        if (token == null || token.isBlank()) {
            return PlatformLookup.error(platform, token, "token_missing");
        }
        AtsBoardClient client = clients.get(platform);
        if (client == null) {
            return PlatformLookup.unsupported(platform, token);
        }
        try {
            return client.fetchBoard(token);
        } catch (RuntimeException e) {
            log.warn("{} lookup failed for {}", platform.label(), token, e);
            return PlatformLookup.error(platform, token, "unexpected_error");
        }
    }

    public PlatformLookup tryAllPlatforms(String url) {
        String token = extractCompanyToken(url);
        if (token == null) {
            log.warn("Could not extract company token from {}", url);
            return PlatformLookup.error(AtsPlatform.NONE, null, "token_missing");
        }
        PlatformLookup last = PlatformLookup.empty(AtsPlatform.NONE, token);
        for (AtsPlatform platform : PROBE_ORDER) {
            PlatformLookup result = lookup(platform, token);
            if (result.hasJobs() || result.requiresRendering()) {
                return result;
            }
            last = result;
        }
        log.info("No jobs found via platform APIs for token {}", token);
        return last;
    }
}
