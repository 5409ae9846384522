package com.jobprospector.hiring.detection.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jobprospector.hiring.detection.model.HiringResult;
import com.jobprospector.hiring.detection.service.CompanyHiringOutcome;

import java.util.List;

public record HiringInfo(
    @JsonProperty("company_id") String companyId,
    @JsonProperty("company_name") String companyName,
    @JsonProperty("is_hiring") boolean isHiring,
    @JsonProperty("job_count") int jobCount,
    @JsonProperty("job_roles") List<String> jobRoles,
    @JsonProperty("career_page_url") String careerPageUrl,
    @JsonProperty("hiring_summary") String hiringSummary,
    @JsonProperty("detection_method") String detectionMethod
) {
    public static HiringInfo from(CompanyHiringOutcome outcome) {
        HiringResult result = outcome.result();
        return new HiringInfo(
            outcome.target().companyId(),
            outcome.target().companyName(),
            result.isHiring(),
            result.jobCount(),
            result.jobRoles(),
            result.careerPageUrl(),
            result.hiringSummary(),
            result.detectionMethod()
        );
    }
}
