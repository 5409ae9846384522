package com.jobprospector.hiring.detection.model;

import java.util.List;

public record PlatformLookup(
    AtsPlatform platform,
    String token,
    Status status,
    List<JobPosting> postings,
    String boardUrl,
    String errorCode
) {
    public enum Status {
        JOBS_FOUND,
        REQUIRES_RENDERING,
        EMPTY,
        ERROR,
        UNSUPPORTED
    }

    public PlatformLookup {
        postings = postings == null ? List.of() : List.copyOf(postings);
    }

    public static PlatformLookup jobs(AtsPlatform platform, String token, List<JobPosting> postings) {
        if (postings == null || postings.isEmpty()) {
            return empty(platform, token);
        }
        return new PlatformLookup(platform, token, Status.JOBS_FOUND, postings, null, null);
    }

    public static PlatformLookup requiresRendering(AtsPlatform platform, String token, String boardUrl) {
        return new PlatformLookup(platform, token, Status.REQUIRES_RENDERING, List.of(), boardUrl, null);
    }

    public static PlatformLookup empty(AtsPlatform platform, String token) {
        return new PlatformLookup(platform, token, Status.EMPTY, List.of(), null, null);
    }

    public static PlatformLookup error(AtsPlatform platform, String token, String errorCode) {
        return new PlatformLookup(platform, token, Status.ERROR, List.of(), null, errorCode);
    }

    public static PlatformLookup unsupported(AtsPlatform platform, String token) {
        return new PlatformLookup(platform, token, Status.UNSUPPORTED, List.of(), null, null);
    }

    public boolean hasJobs() {
        return status == Status.JOBS_FOUND && !postings.isEmpty();
    }

    public boolean requiresRendering() {
        return status == Status.REQUIRES_RENDERING;
    }

    public List<String> titles() {
        return postings.stream()
            .filter(JobPosting::hasTitle)
            .map(posting -> posting.title().trim())
            .toList();
    }

    public String firstPostingUrl() {
        for (JobPosting posting : postings) {
            if (posting.url() != null && !posting.url().isBlank()) {
                return posting.url();
            }
        }
        return null;
    }
}
