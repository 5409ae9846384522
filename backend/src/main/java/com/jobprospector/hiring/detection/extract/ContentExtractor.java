package com.jobprospector.hiring.detection.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobprospector.hiring.detection.llm.LlmCompletionClient;
import com.jobprospector.hiring.detection.model.HiringAnalysis;
import com.jobprospector.hiring.detection.model.HiringResult;
import com.jobprospector.hiring.detection.util.LogText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    static final int MAX_PAGE_CHARS = 10_000;
    static final double TEMPERATURE = 0.1;
    static final int PAGE_MAX_TOKENS = 1000;
    static final int LIST_MAX_TOKENS = 500;

    static final String PARSE_FAILURE_SUMMARY = "Error: Could not parse AI response";
    static final String NOT_CONFIGURED_SUMMARY = "Error: LLM not configured";

    private final LlmCompletionClient llmClient;
    private final LlmResponseParser parser;
    private final ObjectMapper objectMapper;

    public ContentExtractor(LlmCompletionClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
        this.parser = new LlmResponseParser(objectMapper);
    }

    public boolean isAvailable() {
        return llmClient.isAvailable();
    }

    public String providerLabel() {
        return llmClient.providerLabel();
    }

    public HiringAnalysis analyzeCareerPage(String text, String companyName) {
        if (!llmClient.isAvailable()) {
            return HiringAnalysis.failed("llm_unavailable", NOT_CONFIGURED_SUMMARY);
        }
        String pageText = text == null ? "" : text;
        if (pageText.length() > MAX_PAGE_CHARS) {
            pageText = pageText.substring(0, MAX_PAGE_CHARS);
        }

        String reply;
        try {
            reply = llmClient.complete(careerPagePrompt(pageText, companyName), TEMPERATURE, PAGE_MAX_TOKENS);
        } catch (RuntimeException e) {
            log.error("Career page analysis failed for {}: {}", companyName, e.getMessage());
            return HiringAnalysis.failed("llm_error", "Error: " + e.getMessage());
        }

        try {
            JsonNode data = parser.readObject(reply);
            List<String> roles = HiringResult.normalizeRoles(LlmResponseParser.strings(data.path("job_roles")));
            boolean hiring = data.path("is_hiring").asBoolean(false);
            String summary = data.path("hiring_summary").asText("");
            if (summary.length() > HiringResult.MAX_SUMMARY_LENGTH) {
                summary = summary.substring(0, HiringResult.MAX_SUMMARY_LENGTH);
            }
            log.info("Career page analysis for {}: hiring={}, {} roles", companyName, hiring, roles.size());
            return HiringAnalysis.of(hiring, roles, summary);
        } catch (JsonProcessingException e) {
            log.error("Model returned invalid JSON for {}: {}", companyName, e.getOriginalMessage());
            log.debug("Reply was: {}", LogText.preview(reply));
            return HiringAnalysis.failed("parse_error", PARSE_FAILURE_SUMMARY);
        }
    }

    public HiringAnalysis analyzeJobList(List<String> rawTitles, String companyName) {
        if (rawTitles == null || rawTitles.isEmpty()) {
            return HiringAnalysis.of(false, List.of(), "No jobs found");
        }
        try {
            if (!llmClient.isAvailable()) {
                throw new IllegalStateException("LLM not configured");
            }
            String reply = llmClient.complete(jobListPrompt(rawTitles, companyName), TEMPERATURE, LIST_MAX_TOKENS);
            List<String> cleaned = HiringResult.normalizeRoles(parser.readStringArray(reply));
            return HiringAnalysis.of(!cleaned.isEmpty(), cleaned, "Found " + cleaned.size() + " open positions");
        } catch (Exception e) {
            log.warn("Job list analysis failed for {}: {}", companyName, e.getMessage());
            List<String> raw = HiringResult.normalizeRoles(rawTitles);
            return HiringAnalysis.of(!raw.isEmpty(), raw, "Found " + rawTitles.size() + " potential positions");
        }
    }

    private String careerPagePrompt(String text, String companyName) {
        return "Analyze this career page content from " + companyName + " and extract job information.\n\n"
            + "Content:\n" + text + "\n\n"
            + "Extract:\n"
            + "1. is_hiring: Are they currently hiring? (true/false)\n"
            + "2. job_roles: List of specific job titles/roles (array of strings)\n"
            + "3. hiring_summary: Brief summary of hiring status (string, max 200 chars)\n\n"
            + "Return ONLY valid JSON in this exact format, with no other text:\n"
            + "{\n"
            + "  \"is_hiring\": true/false,\n"
            + "  \"job_roles\": [\"Job Title 1\", \"Job Title 2\"],\n"
            + "  \"hiring_summary\": \"brief summary here\"\n"
            + "}\n\n"
            + "Important:\n"
            + "- Only include REAL job titles you find\n"
            + "- If you see \"No open positions\" or similar, set is_hiring to false\n"
            + "- Be specific with job titles (e.g. \"Senior Software Engineer\" not just \"Engineer\")\n"
            + "- Include up to 20 job titles maximum\n";
    }

    private String jobListPrompt(List<String> rawTitles, String companyName) throws JsonProcessingException {
        return "Given these potential job titles from " + companyName + ", clean and filter them.\n\n"
            + "Raw titles:\n" + objectMapper.writeValueAsString(rawTitles) + "\n\n"
            + "Tasks:\n"
            + "1. Remove duplicates\n"
            + "2. Remove non-job entries (like \"About Us\", \"FAQ\")\n"
            + "3. Standardize formatting\n"
            + "4. Keep only real job titles\n\n"
            + "Return ONLY a JSON array of cleaned job titles:\n"
            + "[\"Job Title 1\", \"Job Title 2\"]\n";
    }
}
