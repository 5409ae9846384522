package com.jobprospector.hiring.detection.service;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.ats.PlatformRegistry;
import com.jobprospector.hiring.detection.extract.ContentExtractor;
import com.jobprospector.hiring.detection.fetch.JobTitleHarvester;
import com.jobprospector.hiring.detection.fetch.PageFetcher;
import com.jobprospector.hiring.detection.locate.CareerPageLocator;
import com.jobprospector.hiring.detection.model.AtsPlatform;
import com.jobprospector.hiring.detection.model.CareerPageCandidate;
import com.jobprospector.hiring.detection.model.DiscoveryMethod;
import com.jobprospector.hiring.detection.model.HiringAnalysis;
import com.jobprospector.hiring.detection.model.HiringResult;
import com.jobprospector.hiring.detection.model.PageContent;
import com.jobprospector.hiring.detection.model.PlatformLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Four-layer hiring check for one company: ATS board APIs, career page discovery, rendered page analysis,
 * and a plain-HTTP recovery pass. Each layer runs at most once and the first decisive answer wins.
 */
@Service
public class HiringDetectionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(HiringDetectionOrchestrator.class);

    static final List<String> NEGATIVE_PHRASES = List.of("no open position", "no current opening");
    static final Set<String> TRANSIENT_FETCH_ERRORS = Set.of("timeout", "io_error");
    static final String UNREACHABLE_SUMMARY = "Could not access career page";

    private final PlatformRegistry platformRegistry;
    private final CareerPageLocator careerPageLocator;
    private final PageFetcher pageFetcher;
    private final ContentExtractor contentExtractor;
    private final JobTitleHarvester jobTitleHarvester;
    private final int pageTextLimit;

    public HiringDetectionOrchestrator(
        PlatformRegistry platformRegistry,
        CareerPageLocator careerPageLocator,
        PageFetcher pageFetcher,
        ContentExtractor contentExtractor,
        JobTitleHarvester jobTitleHarvester,
        HiringProperties properties
    ) {
        this.platformRegistry = platformRegistry;
        this.careerPageLocator = careerPageLocator;
        this.pageFetcher = pageFetcher;
        this.contentExtractor = contentExtractor;
        this.jobTitleHarvester = jobTitleHarvester;
        this.pageTextLimit = properties.getLlm().getPageTextLimit();
        if (properties.getLlm().isRequired() && !contentExtractor.isAvailable()) {
            throw new IllegalStateException("hiring.llm.required is set but no LLM API key is configured");
        }
    }

    public HiringResult checkHiring(String companyName, String website) {
        log.info("Checking hiring for {} ({})", companyName, website);

        PlatformLookup lookup = tryPlatformApis(website);
        if (lookup != null && lookup.hasJobs() && !lookup.titles().isEmpty()) {
            String platform = lookup.platform().label();
            List<String> titles = lookup.titles();
            log.info("Layer 1 success for {}: {} API", companyName, platform);
            return HiringResult.fromRoles(
                lookup.firstPostingUrl(),
                titles,
                "Found " + titles.size() + " positions via " + platform,
                platform + " API"
            );
        }

        CareerPageCandidate candidate;
        if (lookup != null && lookup.requiresRendering() && lookup.boardUrl() != null) {
            candidate = CareerPageCandidate.of(lookup.boardUrl(), DiscoveryMethod.ATS_BACKDOOR);
        } else {
            candidate = findCareerPage(website);
        }
        if (!candidate.isFound()) {
            log.warn("No career page found for {}", companyName);
            return HiringResult.noCareerPage();
        }
        String careerUrl = candidate.url();
        log.info("Career page for {} via {}: {}", companyName, candidate.method().label(), careerUrl);

        HiringResult rendered = tryRenderedAnalysis(companyName, careerUrl);
        if (rendered != null) {
            return rendered;
        }
        return recover(companyName, careerUrl);
    }

    public HiringResult scanJobTitles(String companyName, String careerUrl) {
        String html = pageFetcher.fetchHtml(careerUrl, null);
        if (html == null || html.isBlank()) {
            return HiringResult.failed(careerUrl, UNREACHABLE_SUMMARY);
        }
        List<String> rawTitles = jobTitleHarvester.harvest(html);
        log.info("Extracted {} potential job titles from {}", rawTitles.size(), careerUrl);
        HiringAnalysis analysis = contentExtractor.analyzeJobList(rawTitles, companyName);
        return HiringResult.fromRoles(
            careerUrl,
            analysis.isHiring() ? analysis.jobRoles() : List.of(),
            analysis.hiringSummary(),
            "Heuristic DOM + " + contentExtractor.providerLabel()
        );
    }

    private PlatformLookup tryPlatformApis(String website) {
        try {
            return platformRegistry.tryAllPlatforms(website);
        } catch (RuntimeException e) {
            log.error("Platform API layer failed for {}", website, e);
            return null;
        }
    }

    private CareerPageCandidate findCareerPage(String website) {
        try {
            return careerPageLocator.locate(website);
        } catch (RuntimeException e) {
            log.error("Career page search failed for {}", website, e);
            return CareerPageCandidate.none();
        }
    }

    private HiringResult tryRenderedAnalysis(String companyName, String careerUrl) {
        try {
            PageContent page = pageFetcher.fetch(careerUrl);
            if (!page.hasText()) {
                return null;
            }
            String lower = page.text().toLowerCase(Locale.ROOT);
            for (String phrase : NEGATIVE_PHRASES) {
                if (lower.contains(phrase)) {
                    log.info("{} reports no open positions at {}", companyName, careerUrl);
                    return HiringResult.noOpenPositions(careerUrl);
                }
            }
            if (!contentExtractor.isAvailable()) {
                return null;
            }
            HiringAnalysis analysis = contentExtractor.analyzeCareerPage(limit(page.text()), companyName);
            if (analysis.isHiring() && !analysis.jobRoles().isEmpty()) {
                log.info("Layer 3 success for {}", companyName);
                return HiringResult.fromRoles(
                    careerUrl,
                    analysis.jobRoles(),
                    analysis.hiringSummary(),
                    HiringResult.METHOD_PLAYWRIGHT + " + " + contentExtractor.providerLabel()
                );
            }
            return null;
        } catch (RuntimeException e) {
            log.error("Rendered page analysis failed for {}", careerUrl, e);
            return null;
        }
    }

    private HiringResult recover(String companyName, String careerUrl) {
        try {
            AtsPlatform platform = platformRegistry.detectPlatform(careerUrl);
            if (platform.isKnown()) {
                String token = platformRegistry.extractCompanyToken(careerUrl);
                PlatformLookup lookup = platformRegistry.lookup(platform, token);
                List<String> titles = lookup.titles();
                if (lookup.hasJobs() && !titles.isEmpty()) {
                    log.info("Layer 4 ATS recovery for {}: {} jobs via {}", companyName, titles.size(), platform.label());
                    return HiringResult.fromRoles(
                        careerUrl,
                        titles,
                        "Found " + titles.size() + " positions via " + platform.label() + " API",
                        platform.label() + " API (Layer 4 recovery)"
                    );
                }
            }

            PageContent page = pageFetcher.fetchPlain(careerUrl);
            if (page.errorCode() != null) {
                if (TRANSIENT_FETCH_ERRORS.contains(page.errorCode())) {
                    log.warn("Career page {} unreachable for {} ({})", careerUrl, companyName, page.errorCode());
                    throw new TransientDetectionException(careerUrl, UNREACHABLE_SUMMARY);
                }
                return HiringResult.failed(careerUrl, UNREACHABLE_SUMMARY);
            }
            if (!contentExtractor.isAvailable()) {
                return HiringResult.failed(careerUrl, "Mistral API key not configured");
            }
            HiringAnalysis analysis = contentExtractor.analyzeCareerPage(limit(page.text()), companyName);
            log.info("Layer 4 analysis for {}: {} roles", companyName, analysis.jobRoles().size());
            return HiringResult.fromRoles(
                careerUrl,
                analysis.isHiring() ? analysis.jobRoles() : List.of(),
                analysis.hiringSummary(),
                contentExtractor.providerLabel() + " (basic HTTP)"
            );
        } catch (TransientDetectionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Recovery layer failed for {}", careerUrl, e);
            return HiringResult.failed(careerUrl, "Error: " + e.getMessage());
        }
    }

    private String limit(String text) {
        return text.length() <= pageTextLimit ? text : text.substring(0, pageTextLimit);
    }
}
