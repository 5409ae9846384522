package com.jobprospector.hiring.detection.service;

import java.util.List;

public record HiringBatchSummary(int totalCompanies, int hiringCompanies, List<CompanyHiringOutcome> outcomes) {

    public HiringBatchSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static HiringBatchSummary of(List<CompanyHiringOutcome> outcomes) {
        int hiring = (int) outcomes.stream().filter(outcome -> outcome.result().isHiring()).count();
        return new HiringBatchSummary(outcomes.size(), hiring, outcomes);
    }
}
