package com.jobprospector.hiring.detection.locate;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.http.PoliteHttpClient;
import com.jobprospector.hiring.detection.model.AtsPlatform;
import com.jobprospector.hiring.detection.model.CareerPageCandidate;
import com.jobprospector.hiring.detection.model.DiscoveryMethod;
import com.jobprospector.hiring.detection.model.HttpFetchResult;
import com.jobprospector.hiring.detection.model.SearchHit;
import com.jobprospector.hiring.detection.search.WebSearchClient;
import com.jobprospector.hiring.detection.util.CandidateUrls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

@Service
public class CareerPageLocator {
    private static final Logger log = LoggerFactory.getLogger(CareerPageLocator.class);

    private static final List<AtsPlatform> BACKDOOR_PLATFORMS = List.of(
        AtsPlatform.GREENHOUSE,
        AtsPlatform.LEVER,
        AtsPlatform.ASHBY,
        AtsPlatform.WORKABLE
    );
    private static final List<String> SUBDOMAIN_PREFIXES = List.of("jobs", "careers", "www");
    private static final List<String> HINT_TOKENS = List.of(
        "careers",
        "jobs",
        "join",
        "talent",
        "work-with-us"
    );

    private final PoliteHttpClient httpClient;
    private final WebSearchClient searchClient;
    private final HiringProperties properties;

    public CareerPageLocator(PoliteHttpClient httpClient, WebSearchClient searchClient, HiringProperties properties) {
        this.httpClient = httpClient;
        this.searchClient = searchClient;
        this.properties = properties;
    }

    public CareerPageCandidate locate(String website) {
        String domain = CandidateUrls.cleanDomain(website);
        if (domain == null) {
            log.warn("Cannot locate career page for unparseable website '{}'", website);
            return CareerPageCandidate.none();
        }
        CareerPageCandidate candidate = triangulate(domain);
        if (candidate.isFound()) {
            return candidate;
        }
        candidate = probePatterns(website);
        if (candidate.isFound()) {
            return candidate;
        }
        return scanHomepageLinks(website);
    }

    public CareerPageCandidate triangulate(String domain) {
        String cleaned = CandidateUrls.cleanDomain(domain);
        if (cleaned == null) {
            return CareerPageCandidate.none();
        }
        log.info("Triangulating career page for {}", cleaned);

        CareerPageCandidate candidate = findAtsBackdoor(cleaned);
        if (!candidate.isFound()) {
            candidate = checkSitemap(cleaned);
        }
        if (!candidate.isFound()) {
            candidate = findOrganic(cleaned);
        }
        if (candidate.isFound()) {
            log.info("Career page for {} via {}: {}", cleaned, candidate.method().label(), candidate.url());
        } else {
            log.info("Triangulation found nothing for {}", cleaned);
        }
        return candidate;
    }

    CareerPageCandidate findAtsBackdoor(String domain) {
        String company = domain.split("\\.")[0];
        String query = "site:greenhouse.io OR site:lever.co OR site:ashbyhq.com \"" + company + "\"";
        for (SearchHit hit : searchClient.search(query, properties.getSearch().getNumResults())) {
            String host = CandidateUrls.hostOf(hit.link());
            for (AtsPlatform platform : BACKDOOR_PLATFORMS) {
                if (platform.matchesHost(host)) {
                    return CareerPageCandidate.of(hit.link(), DiscoveryMethod.ATS_BACKDOOR);
                }
            }
        }
        return CareerPageCandidate.none();
    }

    CareerPageCandidate checkSitemap(String domain) {
        String sitemapUrl = "https://" + domain + "/sitemap.xml";
        HttpFetchResult fetch = httpClient.getPage(
            sitemapUrl,
            Duration.ofSeconds(properties.getLocator().getSitemapTimeoutSeconds())
        );
        if (!fetch.isOk() || fetch.body() == null) {
            log.debug("Sitemap unavailable for {}: {}", domain, fetch.failureLabel());
            return CareerPageCandidate.none();
        }
        String loc = SitemapLocScanner.firstCareerLocation(fetch.body());
        return loc == null ? CareerPageCandidate.none() : CareerPageCandidate.of(loc, DiscoveryMethod.SITEMAP_DISCOVERY);
    }

    CareerPageCandidate findOrganic(String domain) {
        String query = "site:" + domain + " (careers OR jobs)";
        List<SearchHit> hits = searchClient.search(query, properties.getSearch().getNumResults());
        if (hits.isEmpty()) {
            return CareerPageCandidate.none();
        }
        return CareerPageCandidate.of(hits.get(0).link(), DiscoveryMethod.GOOGLE_ORGANIC);
    }

    public CareerPageCandidate probePatterns(String website) {
        Duration timeout = Duration.ofSeconds(properties.getLocator().getProbeTimeoutSeconds());
        for (String url : candidatePatterns(website)) {
            log.debug("Probing {}", url);
            HttpFetchResult fetch = httpClient.head(url, timeout);
            if (fetch.statusCode() == 200 && fetch.errorCode() == null) {
                log.info("Found career page by pattern: {}", url);
                return CareerPageCandidate.of(url, DiscoveryMethod.PATTERN_PROBE);
            }
        }
        log.info("No career page found via patterns for {}", website);
        return CareerPageCandidate.none();
    }

    List<String> candidatePatterns(String website) {
        String domain = CandidateUrls.cleanDomain(website);
        if (domain == null) {
            return List.of();
        }
        String baseUrl = website.trim();
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            baseUrl = "https://" + baseUrl;
        }
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        String host = CandidateUrls.hostOf(baseUrl);
        String rootDomain = host == null ? domain : host;
        String[] labels = rootDomain.split("\\.");
        String rootUrl = baseUrl;
        if (labels.length > 2 && SUBDOMAIN_PREFIXES.contains(labels[0])) {
            rootDomain = rootDomain.substring(labels[0].length() + 1);
            rootUrl = "https://" + rootDomain;
        }

        LinkedHashSet<String> patterns = new LinkedHashSet<>();
        List<String> paths = properties.getLocator().getProbePaths();
        for (String path : paths) {
            patterns.add(baseUrl + path);
        }
        for (String path : paths) {
            patterns.add(rootUrl + path);
        }
        patterns.add("https://careers." + rootDomain);
        patterns.add("https://jobs." + rootDomain);
        return new ArrayList<>(patterns);
    }

    public CareerPageCandidate scanHomepageLinks(String website) {
        String domain = CandidateUrls.cleanDomain(website);
        if (domain == null) {
            return CareerPageCandidate.none();
        }
        String homepage = "https://" + domain + "/";
        HttpFetchResult fetch = httpClient.getPage(
            homepage,
            Duration.ofSeconds(properties.getLocator().getHomepageTimeoutSeconds())
        );
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("Homepage unavailable for {}: {}", domain, fetch.failureLabel());
            return CareerPageCandidate.none();
        }

        Document doc = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("abs:href");
            if (href == null || href.isBlank()) {
                continue;
            }
            String text = anchor.text() == null ? "" : anchor.text().toLowerCase(Locale.ROOT);
            String hrefLower = href.toLowerCase(Locale.ROOT);
            if (!containsHint(text) && !containsHint(hrefLower)) {
                continue;
            }
            if (hrefLower.startsWith("http://") || hrefLower.startsWith("https://")) {
                String normalized = CandidateUrls.normalize(href);
                if (normalized != null) {
                    log.info("Found career link on homepage of {}: {}", domain, normalized);
                    return CareerPageCandidate.of(normalized, DiscoveryMethod.HOMEPAGE_LINK);
                }
            }
        }
        return CareerPageCandidate.none();
    }

    private boolean containsHint(String value) {
        for (String token : HINT_TOKENS) {
            if (value.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
