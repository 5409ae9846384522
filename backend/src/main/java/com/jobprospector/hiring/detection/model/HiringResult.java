package com.jobprospector.hiring.detection.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Final answer of one hiring check. Roles are trimmed, de-duplicated and capped at {@link #MAX_ROLES};
 * {@code jobCount} and {@code isHiring} are always derived from them.
 */
public record HiringResult(
    @JsonProperty("is_hiring") boolean isHiring,
    @JsonProperty("career_page_url") String careerPageUrl,
    @JsonProperty("job_roles") List<String> jobRoles,
    @JsonProperty("job_count") int jobCount,
    @JsonProperty("hiring_summary") String hiringSummary,
    @JsonProperty("detection_method") String detectionMethod
) {
    public static final int MAX_ROLES = 20;
    public static final int MAX_SUMMARY_LENGTH = 200;

    public static final String METHOD_NONE = "none";
    public static final String METHOD_FAILED = "failed";
    public static final String METHOD_PLAYWRIGHT = "Playwright";

    public HiringResult {
        jobRoles = normalizeRoles(jobRoles);
        jobCount = jobRoles.size();
        isHiring = jobCount > 0;
        hiringSummary = truncate(hiringSummary == null ? "" : hiringSummary.trim(), MAX_SUMMARY_LENGTH);
        detectionMethod = detectionMethod == null || detectionMethod.isBlank() ? METHOD_NONE : detectionMethod;
    }

    public static HiringResult fromRoles(String careerPageUrl, List<String> roles, String summary, String detectionMethod) {
        return new HiringResult(false, careerPageUrl, roles, 0, summary, detectionMethod);
    }

    public static HiringResult noCareerPage() {
        return new HiringResult(false, null, List.of(), 0, "No career page found", METHOD_NONE);
    }

    public static HiringResult noOpenPositions(String careerPageUrl) {
        return new HiringResult(false, careerPageUrl, List.of(), 0, "No open positions", METHOD_PLAYWRIGHT);
    }

    public static HiringResult failed(String careerPageUrl, String summary) {
        return new HiringResult(false, careerPageUrl, List.of(), 0, summary, METHOD_FAILED);
    }

    public static List<String> normalizeRoles(List<String> roles) {
        if (roles == null || roles.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String role : roles) {
            if (role == null) {
                continue;
            }
            String trimmed = role.trim();
            if (!trimmed.isEmpty()) {
                seen.add(trimmed);
            }
            if (seen.size() >= MAX_ROLES) {
                break;
            }
        }
        return List.copyOf(seen);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
