package com.jobprospector.hiring.detection.model;

import java.net.URI;
import java.util.List;
import java.util.Locale;

public enum AtsPlatform {
    GREENHOUSE("Greenhouse", List.of("greenhouse.io")),
    LEVER("Lever", List.of("lever.co")),
    ASHBY("Ashby", List.of("ashbyhq.com")),
    WORKABLE("Workable", List.of("workable.com")),
    NONE("None", List.of());

    private final String label;
    private final List<String> hostSuffixes;

    AtsPlatform(String label, List<String> hostSuffixes) {
        this.label = label;
        this.hostSuffixes = hostSuffixes;
    }

    public String label() {
        return label;
    }

    public List<String> hostSuffixes() {
        return hostSuffixes;
    }

    public boolean isKnown() {
        return this != NONE;
    }

    public boolean matchesHost(String host) {
        if (host == null || host.isBlank()) {
            return false;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        for (String suffix : hostSuffixes) {
            if (lower.equals(suffix) || lower.endsWith("." + suffix)) {
                return true;
            }
        }
        return false;
    }

    public static AtsPlatform fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return NONE;
        }
        String host = hostOf(url);
        if (host != null) {
            for (AtsPlatform platform : values()) {
                if (platform.matchesHost(host)) {
                    return platform;
                }
            }
            return NONE;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (AtsPlatform platform : values()) {
            for (String suffix : platform.hostSuffixes) {
                if (lower.contains(suffix)) {
                    return platform;
                }
            }
        }
        return NONE;
    }

    private static String hostOf(String url) {
        String value = url.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        try {
            String host = new URI(value).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (Exception ignored) {
            return null;
        }
    }
}
