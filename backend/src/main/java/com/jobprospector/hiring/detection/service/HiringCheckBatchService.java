package com.jobprospector.hiring.detection.service;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.model.HiringResult;
import com.jobprospector.hiring.detection.util.BackoffRetrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class HiringCheckBatchService {
    private static final Logger log = LoggerFactory.getLogger(HiringCheckBatchService.class);

    private final HiringDetectionOrchestrator orchestrator;
    private final ExecutorService hiringExecutor;
    private final BackoffRetrier retrier;

    @Autowired
    public HiringCheckBatchService(
        HiringDetectionOrchestrator orchestrator,
        @Qualifier("hiringExecutor") ExecutorService hiringExecutor,
        HiringProperties properties
    ) {
        this(orchestrator, hiringExecutor, new BackoffRetrier(
            properties.getBatch().getRetryMaxAttempts(),
            properties.getBatch().getRetryMultiplier(),
            properties.getBatch().getRetryBaseDelayMs()
        ));
    }

    HiringCheckBatchService(HiringDetectionOrchestrator orchestrator, ExecutorService hiringExecutor, BackoffRetrier retrier) {
        this.orchestrator = orchestrator;
        this.hiringExecutor = hiringExecutor;
        this.retrier = retrier;
    }

    public HiringBatchSummary checkAll(List<CompanyHiringTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("companies must not be empty");
        }
        log.info("Checking hiring status for {} companies", targets.size());

        List<CompletableFuture<CompanyHiringOutcome>> futures = new ArrayList<>();
        for (CompanyHiringTarget target : targets) {
            futures.add(CompletableFuture.supplyAsync(() -> checkOne(target), hiringExecutor));
        }

        List<CompanyHiringOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            CompanyHiringTarget target = targets.get(i);
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Hiring check failed for {}", target.companyName(), cause);
                outcomes.add(new CompanyHiringOutcome(target, HiringResult.failed(null, "Error: " + cause.getMessage())));
            }
        }
        HiringBatchSummary summary = HiringBatchSummary.of(outcomes);
        log.info("Batch complete: {}/{} companies hiring", summary.hiringCompanies(), summary.totalCompanies());
        return summary;
    }

    public HiringResult checkCompany(CompanyHiringTarget target) {
        return checkOne(target).result();
    }

    CompanyHiringOutcome checkOne(CompanyHiringTarget target) {
        try {
            HiringResult result = retrier.call(
                target.companyName(),
                () -> orchestrator.checkHiring(target.companyName(), target.website())
            );
            return new CompanyHiringOutcome(target, result);
        } catch (TransientDetectionException e) {
            log.error("Giving up on {} after {} attempts: {}", target.companyName(), retrier.maxAttempts(), e.getMessage());
            return new CompanyHiringOutcome(target, HiringResult.failed(e.careerPageUrl(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Giving up on {} after {} attempts", target.companyName(), retrier.maxAttempts(), e);
            return new CompanyHiringOutcome(target, HiringResult.failed(null, "Error: " + e.getMessage()));
        }
    }
}
