package com.jobprospector.hiring.detection.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class CandidateUrls {
    private CandidateUrls() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.startsWith("//")) {
            value = "https:" + value;
        }
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            URI uri = new URI(value);
            if (uri.getHost() == null) {
                return null;
            }
            String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            String normalized = scheme + "://" + host + port + path;
            if (normalized.endsWith("/") && path.length() > 1) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            String filteredQuery = filterTrackingParams(uri.getRawQuery());
            if (filteredQuery != null) {
                normalized = normalized + "?" + filteredQuery;
            }
            return normalized;
        } catch (Exception e) {
            return null;
        }
    }

    public static String cleanDomain(String website) {
        if (website == null || website.isBlank()) {
            return null;
        }
        String value = website.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        try {
            String host = new URI(value).getHost();
            if (host == null || host.isBlank()) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (Exception e) {
            return null;
        }
    }

    public static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (Exception e) {
            return null;
        }
    }

    static String filterTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return null;
        }
        List<String> kept = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isBlank()) {
                continue;
            }
            int idx = part.indexOf('=');
            String key = (idx >= 0 ? part.substring(0, idx) : part).toLowerCase(Locale.ROOT);
            if (key.startsWith("utm_") || key.equals("ref") || key.equals("source")
                || key.equals("gh_src") || key.equals("lever-source")) {
                continue;
            }
            kept.add(part);
        }
        return kept.isEmpty() ? null : String.join("&", kept);
    }
}
