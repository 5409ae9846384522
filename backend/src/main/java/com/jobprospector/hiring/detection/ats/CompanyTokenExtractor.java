package com.jobprospector.hiring.detection.ats;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives the short company slug that ATS boards are keyed by, e.g. {@code jobs.lever.co/netflix -> netflix},
 * {@code integrate.greenhouse.io -> integrate}, {@code jobs.primary.vc -> primary}.
 */
public final class CompanyTokenExtractor {
    static final Set<String> GENERIC_PATH_SEGMENTS = Set.of(
        "boards", "postings", "api", "v0", "v1", "embed", "job_board"
    );
    static final Set<String> IGNORED_HOST_LABELS = Set.of(
        "com", "co", "io", "net", "org", "ai", "vc", "greenhouse", "lever", "ashbyhq", "workable"
    );
    private static final List<String> HOST_PREFIXES = List.of("www.", "jobs.", "careers.");

    private CompanyTokenExtractor() {
    }

    public static String extract(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (Exception e) {
            return null;
        }

        String path = uri.getPath();
        if (path != null && path.length() > 1) {
            for (String segment : path.split("/")) {
                if (segment.isBlank()) {
                    continue;
                }
                if (!GENERIC_PATH_SEGMENTS.contains(segment.toLowerCase(Locale.ROOT))) {
                    return segment;
                }
                break;
            }
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return null;
        }
        host = stripPrefixes(host.toLowerCase(Locale.ROOT));
        String[] labels = host.split("\\.");
        List<String> kept = new ArrayList<>();
        for (String label : labels) {
            if (!label.isBlank() && !IGNORED_HOST_LABELS.contains(label)) {
                kept.add(label);
            }
        }
        if (!kept.isEmpty()) {
            return kept.get(0);
        }
        return labels.length > 0 && !labels[0].isBlank() ? labels[0] : null;
    }

    static String stripPrefixes(String host) {
        String result = host;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String prefix : HOST_PREFIXES) {
                if (result.startsWith(prefix) && result.length() > prefix.length()) {
                    result = result.substring(prefix.length());
                    stripped = true;
                }
            }
        }
        return result;
    }
}
