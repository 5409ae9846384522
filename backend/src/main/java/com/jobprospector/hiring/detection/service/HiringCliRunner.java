package com.jobprospector.hiring.detection.service;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.model.HiringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot batch check from the command line, e.g.
 * {@code --hiring.cli.run=true --hiring.cli.companies="Linear=https://linear.app;Acme=acme.com"}.
 */
@Component
public class HiringCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HiringCliRunner.class);

    private final HiringProperties properties;
    private final HiringCheckBatchService batchService;
    private final ConfigurableApplicationContext applicationContext;

    public HiringCliRunner(
        HiringProperties properties,
        HiringCheckBatchService batchService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.batchService = batchService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<CompanyHiringTarget> targets = parseTargets(properties.getCli().getCompanies());
        if (targets.isEmpty()) {
            log.warn("hiring.cli.run is set but hiring.cli.companies is empty");
        } else {
            HiringBatchSummary summary = batchService.checkAll(targets);
            for (CompanyHiringOutcome outcome : summary.outcomes()) {
                HiringResult result = outcome.result();
                log.info(
                    "Summary {}: hiring={}, jobs={}, method={}, careerPage={}, summary={}",
                    outcome.target().companyName(),
                    result.isHiring(),
                    result.jobCount(),
                    result.detectionMethod(),
                    result.careerPageUrl(),
                    result.hiringSummary()
                );
            }
            log.info("{} of {} companies hiring", summary.hiringCompanies(), summary.totalCompanies());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static List<CompanyHiringTarget> parseTargets(String raw) {
        List<CompanyHiringTarget> targets = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return targets;
        }
        for (String entry : raw.split(";")) {
            int idx = entry.indexOf('=');
            if (idx <= 0 || idx == entry.length() - 1) {
                if (!entry.isBlank()) {
                    log.warn("Ignoring malformed company entry '{}'", entry.trim());
                }
                continue;
            }
            String name = entry.substring(0, idx).trim();
            String website = entry.substring(idx + 1).trim();
            if (!name.isEmpty() && !website.isEmpty()) {
                targets.add(new CompanyHiringTarget(null, name, website));
            }
        }
        return targets;
    }
}
