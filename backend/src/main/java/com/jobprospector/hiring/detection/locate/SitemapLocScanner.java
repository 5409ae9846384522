package com.jobprospector.hiring.detection.locate;

import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient {@code <loc>} scanner. Works on truncated or slightly broken sitemap XML where a real parser would give up.
 */
final class SitemapLocScanner {
    private static final Pattern LOC = Pattern.compile("<loc>\\s*(.*?)\\s*</loc>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final List<String> CAREER_HINTS = List.of("career", "jobs", "join");

    private SitemapLocScanner() {
    }

    static List<String> locations(String xml) {
        List<String> out = new ArrayList<>();
        if (xml == null || xml.isBlank()) {
            return out;
        }
        Matcher matcher = LOC.matcher(xml);
        while (matcher.find()) {
            String raw = matcher.group(1);
            if (raw.startsWith("<![CDATA[") && raw.endsWith("]]>")) {
                raw = raw.substring(9, raw.length() - 3);
            }
            String value = Parser.unescapeEntities(raw.trim(), false);
            if (!value.isBlank()) {
                out.add(value);
            }
        }
        return out;
    }

    static String firstCareerLocation(String xml) {
        for (String loc : locations(xml)) {
            String lower = loc.toLowerCase(Locale.ROOT);
            for (String hint : CAREER_HINTS) {
                if (lower.contains(hint)) {
                    return loc;
                }
            }
        }
        return null;
    }
}
