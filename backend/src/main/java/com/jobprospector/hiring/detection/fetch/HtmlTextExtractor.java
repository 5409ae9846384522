package com.jobprospector.hiring.detection.fetch;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

public final class HtmlTextExtractor {
    private static final String NON_VISIBLE = "script, style, noscript, template, svg";

    private HtmlTextExtractor() {
    }

    public static String visibleText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html);
        document.select(NON_VISIBLE).remove();
        String text = document.body() == null ? document.text() : document.body().text();
        return text.replaceAll("\\s+", " ").trim();
    }
}
