package com.jobprospector.hiring.detection.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jobprospector.hiring.detection.service.HiringBatchSummary;

import java.util.List;

public record HiringResponse(
    boolean success,
    @JsonProperty("total_companies") int totalCompanies,
    @JsonProperty("hiring_companies") int hiringCompanies,
    List<HiringInfo> results
) {
    public static HiringResponse from(HiringBatchSummary summary) {
        return new HiringResponse(
            true,
            summary.totalCompanies(),
            summary.hiringCompanies(),
            summary.outcomes().stream().map(HiringInfo::from).toList()
        );
    }
}
