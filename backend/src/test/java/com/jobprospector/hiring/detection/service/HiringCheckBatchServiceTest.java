package com.jobprospector.hiring.detection.service;

import com.jobprospector.hiring.detection.model.HiringResult;
import com.jobprospector.hiring.detection.util.BackoffRetrier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HiringCheckBatchServiceTest {
    @Mock
    private HiringDetectionOrchestrator orchestrator;

    private ExecutorService executor;
    private HiringCheckBatchService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        service = new HiringCheckBatchService(orchestrator, executor, new BackoffRetrier(3, 2.0, 0, millis -> { }));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void outcomesKeepInputOrderAndCountHiringCompanies() {
        when(orchestrator.checkHiring("Linear", "https://linear.app"))
            .thenReturn(HiringResult.fromRoles("https://linear.app/careers", List.of("Engineer"), "1 role", "Ashby API"));
        when(orchestrator.checkHiring("Quiet", "quiet.io")).thenReturn(HiringResult.noCareerPage());
        when(orchestrator.checkHiring("Acme", "acme.com"))
            .thenReturn(HiringResult.fromRoles("https://acme.com/jobs", List.of("Designer", "PM"), "2 roles", "Greenhouse API"));

        HiringBatchSummary summary = service.checkAll(List.of(
            new CompanyHiringTarget("1", "Linear", "https://linear.app"),
            new CompanyHiringTarget("2", "Quiet", "quiet.io"),
            new CompanyHiringTarget("3", "Acme", "acme.com")
        ));

        assertThat(summary.totalCompanies()).isEqualTo(3);
        assertThat(summary.hiringCompanies()).isEqualTo(2);
        assertThat(summary.outcomes())
            .extracting(outcome -> outcome.target().companyName())
            .containsExactly("Linear", "Quiet", "Acme");
        assertThat(summary.outcomes().get(2).result().jobCount()).isEqualTo(2);
    }

    @Test
    void transientFailureIsRetried() {
        when(orchestrator.checkHiring("Acme", "acme.com"))
            .thenThrow(new IllegalStateException("connection reset"))
            .thenReturn(HiringResult.noOpenPositions("https://acme.com/careers"));

        HiringBatchSummary summary = service.checkAll(List.of(new CompanyHiringTarget(null, "Acme", "acme.com")));

        assertThat(summary.outcomes().get(0).result().hiringSummary()).isEqualTo("No open positions");
        verify(orchestrator, times(2)).checkHiring("Acme", "acme.com");
    }

    @Test
    void exhaustedRetriesBecomeFailedResult() {
        when(orchestrator.checkHiring("Acme", "acme.com")).thenThrow(new IllegalStateException("boom"));

        HiringBatchSummary summary = service.checkAll(List.of(new CompanyHiringTarget("7", "Acme", "acme.com")));

        HiringResult result = summary.outcomes().get(0).result();
        assertThat(result.isHiring()).isFalse();
        assertThat(result.detectionMethod()).isEqualTo("failed");
        assertThat(result.hiringSummary()).isEqualTo("Error: boom");
        assertThat(summary.hiringCompanies()).isZero();
        verify(orchestrator, times(3)).checkHiring("Acme", "acme.com");
    }

    @Test
    void unreachableCareerPageIsRetriedThenReported() {
        when(orchestrator.checkHiring("Acme", "acme.com"))
            .thenThrow(new TransientDetectionException("https://acme.com/careers", "Could not access career page"));

        HiringResult result = service.checkCompany(new CompanyHiringTarget(null, "Acme", "acme.com"));

        assertThat(result.detectionMethod()).isEqualTo("failed");
        assertThat(result.careerPageUrl()).isEqualTo("https://acme.com/careers");
        assertThat(result.hiringSummary()).isEqualTo("Could not access career page");
        verify(orchestrator, times(3)).checkHiring("Acme", "acme.com");
    }

    @Test
    void unreachableCareerPageRecoversOnRetry() {
        when(orchestrator.checkHiring("Acme", "acme.com"))
            .thenThrow(new TransientDetectionException("https://acme.com/careers", "Could not access career page"))
            .thenReturn(HiringResult.fromRoles("https://acme.com/careers", List.of("Support Engineer"), "1 role", "Mistral AI (basic HTTP)"));

        HiringResult result = service.checkCompany(new CompanyHiringTarget(null, "Acme", "acme.com"));

        assertThat(result.isHiring()).isTrue();
        assertThat(result.jobRoles()).containsExactly("Support Engineer");
        verify(orchestrator, times(2)).checkHiring("Acme", "acme.com");
    }

    @Test
    void emptyBatchIsRejected() {
        assertThatThrownBy(() -> service.checkAll(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(orchestrator);
    }
}
