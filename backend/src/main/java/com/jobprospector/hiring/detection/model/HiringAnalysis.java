package com.jobprospector.hiring.detection.model;

import java.util.List;

public record HiringAnalysis(boolean isHiring, List<String> jobRoles, String hiringSummary, String errorCode) {

    public HiringAnalysis {
        jobRoles = jobRoles == null ? List.of() : List.copyOf(jobRoles);
        hiringSummary = hiringSummary == null ? "" : hiringSummary;
    }

    public static HiringAnalysis of(boolean isHiring, List<String> jobRoles, String hiringSummary) {
        return new HiringAnalysis(isHiring, jobRoles, hiringSummary, null);
    }

    public static HiringAnalysis failed(String errorCode, String hiringSummary) {
        return new HiringAnalysis(false, List.of(), hiringSummary, errorCode);
    }

    public boolean isFailure() {
        return errorCode != null;
    }
}
