package com.jobprospector.hiring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "hiring")
public class HiringProperties {
    private static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_4) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15"
    );

    private Http http = new Http();
    private Platform platform = new Platform();
    private Search search = new Search();
    private Locator locator = new Locator();
    private Fetch fetch = new Fetch();
    private Llm llm = new Llm();
    private Batch batch = new Batch();
    private Cli cli = new Cli();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Platform getPlatform() {
        return platform;
    }

    public void setPlatform(Platform platform) {
        this.platform = platform;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Locator getLocator() {
        return locator;
    }

    public void setLocator(Locator locator) {
        this.locator = locator;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static List<String> normalizeUserAgents(List<String> candidates) {
        if (candidates == null) {
            return DEFAULT_USER_AGENTS;
        }
        List<String> cleaned = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                cleaned.add(candidate.trim());
            }
        }
        return cleaned.isEmpty() ? DEFAULT_USER_AGENTS : List.copyOf(cleaned);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static class Http {
        private List<String> userAgents = DEFAULT_USER_AGENTS;
        private int globalConcurrency = 20;
        private int connectTimeoutSeconds = 10;
        private int maxBodyBytes = 3_000_000;

        public List<String> getUserAgents() {
            return userAgents;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = normalizeUserAgents(userAgents);
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
        }

        public int getMaxBodyBytes() {
            return Math.max(1024, maxBodyBytes);
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = Math.max(1024, maxBodyBytes);
        }
    }

    public static class Platform {
        private int timeoutSeconds = 10;
        private String greenhouseApiBase = "https://boards-api.greenhouse.io/v1/boards/";
        private String leverApiBase = "https://api.lever.co/v0/postings/";
        private String ashbyBoardBase = "https://jobs.ashbyhq.com/";

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public String getGreenhouseApiBase() {
            return greenhouseApiBase;
        }

        public void setGreenhouseApiBase(String greenhouseApiBase) {
            this.greenhouseApiBase = withTrailingSlash(greenhouseApiBase, this.greenhouseApiBase);
        }

        public String getLeverApiBase() {
            return leverApiBase;
        }

        public void setLeverApiBase(String leverApiBase) {
            this.leverApiBase = withTrailingSlash(leverApiBase, this.leverApiBase);
        }

        public String getAshbyBoardBase() {
            return ashbyBoardBase;
        }

        public void setAshbyBoardBase(String ashbyBoardBase) {
            this.ashbyBoardBase = withTrailingSlash(ashbyBoardBase, this.ashbyBoardBase);
        }

        private static String withTrailingSlash(String candidate, String fallback) {
            if (isBlank(candidate)) {
                return fallback;
            }
            String trimmed = candidate.trim();
            return trimmed.endsWith("/") ? trimmed : trimmed + "/";
        }
    }

    public static class Search {
        private String apiKey;
        private String endpoint = "https://google.serper.dev/search";
        private int numResults = 5;
        private int timeoutSeconds = 15;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = isBlank(apiKey) ? null : apiKey.trim();
        }

        public boolean isConfigured() {
            return !isBlank(apiKey);
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            if (!isBlank(endpoint)) {
                this.endpoint = endpoint.trim();
            }
        }

        public int getNumResults() {
            return Math.min(100, Math.max(1, numResults));
        }

        public void setNumResults(int numResults) {
            this.numResults = Math.min(100, Math.max(1, numResults));
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Locator {
        private int sitemapTimeoutSeconds = 10;
        private int probeTimeoutSeconds = 5;
        private int homepageTimeoutSeconds = 10;
        private List<String> probePaths = List.of(
            "/careers",
            "/jobs",
            "/company/careers",
            "/about/careers",
            "/join-us",
            "/work-with-us",
            "/team"
        );

        public int getSitemapTimeoutSeconds() {
            return Math.max(1, sitemapTimeoutSeconds);
        }

        public void setSitemapTimeoutSeconds(int sitemapTimeoutSeconds) {
            this.sitemapTimeoutSeconds = Math.max(1, sitemapTimeoutSeconds);
        }

        public int getProbeTimeoutSeconds() {
            return Math.max(1, probeTimeoutSeconds);
        }

        public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
            this.probeTimeoutSeconds = Math.max(1, probeTimeoutSeconds);
        }

        public int getHomepageTimeoutSeconds() {
            return Math.max(1, homepageTimeoutSeconds);
        }

        public void setHomepageTimeoutSeconds(int homepageTimeoutSeconds) {
            this.homepageTimeoutSeconds = Math.max(1, homepageTimeoutSeconds);
        }

        public List<String> getProbePaths() {
            return probePaths;
        }

        public void setProbePaths(List<String> probePaths) {
            if (probePaths != null && !probePaths.isEmpty()) {
                this.probePaths = List.copyOf(probePaths);
            }
        }
    }

    public static class Fetch {
        private int plainTimeoutSeconds = 10;
        private int minTextLength = 500;
        private boolean browserEnabled = true;
        private int renderTimeoutSeconds = 30;
        private int selectorTimeoutSeconds = 5;
        private int maxConcurrentBrowsers = 2;

        public int getPlainTimeoutSeconds() {
            return Math.max(1, plainTimeoutSeconds);
        }

        public void setPlainTimeoutSeconds(int plainTimeoutSeconds) {
            this.plainTimeoutSeconds = Math.max(1, plainTimeoutSeconds);
        }

        public int getMinTextLength() {
            return Math.max(0, minTextLength);
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = Math.max(0, minTextLength);
        }

        public boolean isBrowserEnabled() {
            return browserEnabled;
        }

        public void setBrowserEnabled(boolean browserEnabled) {
            this.browserEnabled = browserEnabled;
        }

        public int getRenderTimeoutSeconds() {
            return Math.max(1, renderTimeoutSeconds);
        }

        public void setRenderTimeoutSeconds(int renderTimeoutSeconds) {
            this.renderTimeoutSeconds = Math.max(1, renderTimeoutSeconds);
        }

        public int getSelectorTimeoutSeconds() {
            return Math.max(1, selectorTimeoutSeconds);
        }

        public void setSelectorTimeoutSeconds(int selectorTimeoutSeconds) {
            this.selectorTimeoutSeconds = Math.max(1, selectorTimeoutSeconds);
        }

        public int getMaxConcurrentBrowsers() {
            return Math.max(1, maxConcurrentBrowsers);
        }

        public void setMaxConcurrentBrowsers(int maxConcurrentBrowsers) {
            this.maxConcurrentBrowsers = Math.max(1, maxConcurrentBrowsers);
        }
    }

    public static class Llm {
        private String apiKey;
        private String baseUrl = "https://api.mistral.ai/v1";
        private String modelName = "mistral-large-latest";
        private String providerLabel = "Mistral AI";
        private int rateLimitRpm = 60;
        private int timeoutSeconds = 60;
        private int pageTextLimit = 15_000;
        private boolean required;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = isBlank(apiKey) ? null : apiKey.trim();
        }

        public boolean isConfigured() {
            return !isBlank(apiKey);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (!isBlank(baseUrl)) {
                this.baseUrl = baseUrl.trim();
            }
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            if (!isBlank(modelName)) {
                this.modelName = modelName.trim();
            }
        }

        public String getProviderLabel() {
            return providerLabel;
        }

        public void setProviderLabel(String providerLabel) {
            if (!isBlank(providerLabel)) {
                this.providerLabel = providerLabel.trim();
            }
        }

        public int getRateLimitRpm() {
            return Math.max(1, rateLimitRpm);
        }

        public void setRateLimitRpm(int rateLimitRpm) {
            this.rateLimitRpm = Math.max(1, rateLimitRpm);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getPageTextLimit() {
            return Math.max(1_000, pageTextLimit);
        }

        public void setPageTextLimit(int pageTextLimit) {
            this.pageTextLimit = Math.max(1_000, pageTextLimit);
        }

        public boolean isRequired() {
            return required;
        }

        public void setRequired(boolean required) {
            this.required = required;
        }
    }

    public static class Batch {
        private int concurrency = 10;
        private int retryMaxAttempts = 3;
        private double retryMultiplier = 2.0;
        private long retryBaseDelayMs = 1000;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getRetryMaxAttempts() {
            return Math.max(1, retryMaxAttempts);
        }

        public void setRetryMaxAttempts(int retryMaxAttempts) {
            this.retryMaxAttempts = Math.max(1, retryMaxAttempts);
        }

        public double getRetryMultiplier() {
            return Math.max(1.0, retryMultiplier);
        }

        public void setRetryMultiplier(double retryMultiplier) {
            this.retryMultiplier = Math.max(1.0, retryMultiplier);
        }

        public long getRetryBaseDelayMs() {
            return Math.max(0L, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0L, retryBaseDelayMs);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String companies = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCompanies() {
            return companies;
        }

        public void setCompanies(String companies) {
            this.companies = isBlank(companies) ? "" : companies.trim();
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
