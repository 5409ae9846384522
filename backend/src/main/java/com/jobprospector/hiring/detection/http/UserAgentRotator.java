package com.jobprospector.hiring.detection.http;

import com.jobprospector.hiring.config.HiringProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class UserAgentRotator {
    private final List<String> userAgents;

    public UserAgentRotator(HiringProperties properties) {
        this.userAgents = HiringProperties.normalizeUserAgents(properties.getHttp().getUserAgents());
    }

    public String next() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
