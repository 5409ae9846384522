package com.jobprospector.hiring.detection.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record HiringCheckRequest(
    @JsonProperty("company_name") @JsonAlias("companyName") String companyName,
    String website,
    @JsonProperty("career_page_url") @JsonAlias("careerPageUrl") String careerPageUrl
) {
}
