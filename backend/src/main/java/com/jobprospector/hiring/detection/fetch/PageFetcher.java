package com.jobprospector.hiring.detection.fetch;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.http.PoliteHttpClient;
import com.jobprospector.hiring.detection.model.FetchMode;
import com.jobprospector.hiring.detection.model.HttpFetchResult;
import com.jobprospector.hiring.detection.model.PageContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PoliteHttpClient httpClient;
    private final BrowserRenderer browserRenderer;
    private final HiringProperties.Fetch config;

    public PageFetcher(PoliteHttpClient httpClient, BrowserRenderer browserRenderer, HiringProperties properties) {
        this.httpClient = httpClient;
        this.browserRenderer = browserRenderer;
        this.config = properties.getFetch();
    }

    public PageContent fetchPlain(String url) {
        HttpFetchResult fetch = httpClient.getPage(url, Duration.ofSeconds(config.getPlainTimeoutSeconds()));
        if (!fetch.isOk() || fetch.body() == null) {
            log.debug("Plain fetch of {} failed: {}", url, fetch.failureLabel());
            return PageContent.empty(url, fetch.failureLabel());
        }
        String text = HtmlTextExtractor.visibleText(fetch.body());
        return new PageContent(fetch.finalUrlOrRequested(), fetch.body(), text, FetchMode.PLAIN_HTTP, null);
    }

    public PageContent fetch(String url) {
        return fetch(url, null);
    }

    public PageContent fetch(String url, String waitSelector) {
        PageContent plain = fetchPlain(url);
        if (plain.textLength() >= config.getMinTextLength()) {
            return plain;
        }
        if (!browserRenderer.isAvailable()) {
            return plain;
        }

        log.info("Plain text of {} is {} chars; rendering in browser", url, plain.textLength());
        String html = browserRenderer.render(url, waitSelector);
        if (html == null || html.isBlank()) {
            return plain.hasText() ? plain : PageContent.empty(url, "render_failed");
        }
        String text = HtmlTextExtractor.visibleText(html);
        if (text.length() < plain.textLength()) {
            return plain;
        }
        return new PageContent(url, html, text, FetchMode.BROWSER, null);
    }

    public String fetchHtml(String url, String waitSelector) {
        if (browserRenderer.isAvailable()) {
            String html = browserRenderer.render(url, waitSelector);
            if (html != null && !html.isBlank()) {
                return html;
            }
        }
        PageContent plain = fetchPlain(url);
        return plain.html();
    }
}
