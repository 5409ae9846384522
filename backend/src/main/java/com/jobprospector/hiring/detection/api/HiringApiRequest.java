package com.jobprospector.hiring.detection.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record HiringApiRequest(List<Company> companies) {

    public record Company(
        @JsonProperty("company_id") @JsonAlias({"crm_id", "companyId"}) String companyId,
        @JsonProperty("company_name") @JsonAlias("companyName") String companyName,
        String website
    ) {
    }
}
