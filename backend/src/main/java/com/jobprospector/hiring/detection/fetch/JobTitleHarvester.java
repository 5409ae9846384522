package com.jobprospector.hiring.detection.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.jobprospector.hiring.detection.util.JsonNodes.firstNonBlank;
import static com.jobprospector.hiring.detection.util.JsonNodes.text;

@Component
public class JobTitleHarvester {
    private static final String TAGS = "h2, h3, h4, a, div, li";
    private static final List<String> LISTING_MARKERS = List.of(
        ".job-title",
        ".job-listing",
        ".position-title",
        ".opening-title",
        ".career-title",
        "[data-job-title]",
        "[data-position]"
    );
    private static final int MIN_LENGTH = 6;
    private static final int MAX_LENGTH = 99;

    private final ObjectMapper objectMapper;

    public JobTitleHarvester(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> harvest(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html);
        Set<String> titles = new LinkedHashSet<>();

        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                List<JsonNode> postings = new ArrayList<>();
                collectJobPostingNodes(objectMapper.readTree(payload), postings);
                for (JsonNode posting : postings) {
                    addIfPlausible(titles, firstNonBlank(text(posting, "title"), text(posting, "name")));
                }
            } catch (JsonProcessingException ignored) {
                // Malformed JSON-LD blocks are common; the remaining blocks are still scanned.
            }
        }

        for (String marker : LISTING_MARKERS) {
            for (Element element : document.select(selectorFor(marker))) {
                addIfPlausible(titles, element.text());
            }
        }
        return new ArrayList<>(titles);
    }

    private static String selectorFor(String marker) {
        StringBuilder selector = new StringBuilder();
        for (String tag : TAGS.split(",\\s*")) {
            if (selector.length() > 0) {
                selector.append(", ");
            }
            selector.append(tag).append(marker);
        }
        return selector.toString();
    }

    private static void addIfPlausible(Set<String> titles, String value) {
        if (value == null) {
            return;
        }
        String trimmed = value.replaceAll("\\s+", " ").trim();
        if (trimmed.length() >= MIN_LENGTH && trimmed.length() <= MAX_LENGTH) {
            titles.add(trimmed);
        }
    }

    private void collectJobPostingNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isJobPostingType(node.get("@type"))) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectJobPostingNodes(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostingNodes(child, out);
            }
        }
    }

    private boolean isJobPostingType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }
}
