package com.jobprospector.hiring.detection.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

final class LlmResponseParser {
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    LlmResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static String stripFences(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return text;
        }
        String inner = text.substring(open + FENCE.length());
        int close = inner.indexOf(FENCE);
        if (close >= 0) {
            inner = inner.substring(0, close);
        }
        inner = inner.stripLeading();
        if (inner.regionMatches(true, 0, "json", 0, 4)) {
            inner = inner.substring(4);
        }
        return inner.trim();
    }

    JsonNode readObject(String raw) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(stripFences(raw));
        if (node == null || !node.isObject()) {
            throw new MalformedReplyException("expected a JSON object");
        }
        return node;
    }

    List<String> readStringArray(String raw) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(stripFences(raw));
        if (node == null || !node.isArray()) {
            throw new MalformedReplyException("expected a JSON array");
        }
        return strings(node);
    }

    static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return out;
        }
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                out.add(item.asText().trim());
            }
        }
        return out;
    }

    static final class MalformedReplyException extends JsonProcessingException {
        MalformedReplyException(String message) {
            super(message);
        }
    }
}
