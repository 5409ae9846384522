package com.jobprospector.hiring.detection.api;

import com.jobprospector.hiring.detection.model.HiringResult;
import com.jobprospector.hiring.detection.service.CompanyHiringTarget;
import com.jobprospector.hiring.detection.service.HiringCheckBatchService;
import com.jobprospector.hiring.detection.service.HiringDetectionOrchestrator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/hiring")
public class HiringController {
    private final HiringCheckBatchService batchService;
    private final HiringDetectionOrchestrator orchestrator;

    public HiringController(HiringCheckBatchService batchService, HiringDetectionOrchestrator orchestrator) {
        this.batchService = batchService;
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public HiringResponse checkCompanies(@RequestBody HiringApiRequest request) {
        if (request == null || request.companies() == null || request.companies().isEmpty()) {
            throw new IllegalArgumentException("companies must contain at least one entry");
        }
        List<CompanyHiringTarget> targets = new ArrayList<>();
        for (HiringApiRequest.Company company : request.companies()) {
            if (company == null || isBlank(company.companyName()) || isBlank(company.website())) {
                throw new IllegalArgumentException("each company needs company_name and website");
            }
            targets.add(new CompanyHiringTarget(company.companyId(), company.companyName().trim(), company.website().trim()));
        }
        return HiringResponse.from(batchService.checkAll(targets));
    }

    @PostMapping("/check")
    public HiringResult checkCompany(@RequestBody HiringCheckRequest request) {
        if (request == null || isBlank(request.companyName()) || isBlank(request.website())) {
            throw new IllegalArgumentException("company_name and website are required");
        }
        return batchService.checkCompany(
            new CompanyHiringTarget(null, request.companyName().trim(), request.website().trim()));
    }

    @PostMapping("/titles")
    public HiringResult scanTitles(@RequestBody HiringCheckRequest request) {
        if (request == null || isBlank(request.companyName()) || isBlank(request.careerPageUrl())) {
            throw new IllegalArgumentException("company_name and career_page_url are required");
        }
        return orchestrator.scanJobTitles(request.companyName().trim(), request.careerPageUrl().trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
