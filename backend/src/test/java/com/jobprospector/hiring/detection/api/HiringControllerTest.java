package com.jobprospector.hiring.detection.api;

import com.jobprospector.hiring.detection.model.HiringResult;
import com.jobprospector.hiring.detection.service.CompanyHiringOutcome;
import com.jobprospector.hiring.detection.service.CompanyHiringTarget;
import com.jobprospector.hiring.detection.service.HiringBatchSummary;
import com.jobprospector.hiring.detection.service.HiringCheckBatchService;
import com.jobprospector.hiring.detection.service.HiringDetectionOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HiringControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HiringCheckBatchService batchService;

    @MockBean
    private HiringDetectionOrchestrator orchestrator;

    @Test
    void batchResponseUsesSnakeCaseFields() throws Exception {
        CompanyHiringTarget target = new CompanyHiringTarget("crm-1", "Acme", "acme.com");
        HiringResult result = HiringResult.fromRoles(
            "https://boards.greenhouse.io/acme/jobs/1", List.of("Backend Engineer"), "Found 1 positions via Greenhouse", "Greenhouse API");
        when(batchService.checkAll(any())).thenReturn(HiringBatchSummary.of(List.of(new CompanyHiringOutcome(target, result))));

        mockMvc.perform(post("/api/hiring")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"companies": [{"crm_id": "crm-1", "company_name": "Acme", "website": "acme.com"}]}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.total_companies").value(1))
            .andExpect(jsonPath("$.hiring_companies").value(1))
            .andExpect(jsonPath("$.results[0].company_id").value("crm-1"))
            .andExpect(jsonPath("$.results[0].is_hiring").value(true))
            .andExpect(jsonPath("$.results[0].job_roles[0]").value("Backend Engineer"))
            .andExpect(jsonPath("$.results[0].detection_method").value("Greenhouse API"));
    }

    @Test
    void emptyCompanyListIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/hiring")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"companies\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
        verifyNoInteractions(batchService);
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/hiring")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void singleCheckAcceptsCamelCaseAliases() throws Exception {
        when(batchService.checkCompany(new CompanyHiringTarget(null, "Acme", "acme.com"))).thenReturn(HiringResult.noCareerPage());

        mockMvc.perform(post("/api/hiring/check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"companyName\": \" Acme \", \"website\": \"acme.com\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_hiring").value(false))
            .andExpect(jsonPath("$.job_count").value(0))
            .andExpect(jsonPath("$.hiring_summary").value("No career page found"))
            .andExpect(jsonPath("$.detection_method").value("none"));
    }

    @Test
    void titleScanRequiresCareerPage() throws Exception {
        mockMvc.perform(post("/api/hiring/titles")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company_name\": \"Acme\"}"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(orchestrator);
    }
}
