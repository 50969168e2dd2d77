package com.precare.risk.insight;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Narrative insight generator backed by the Anthropic Messages API
 * (https://docs.anthropic.com/en/api/messages).
 * <p>
 * Every failure (no API key, transport error, non-2xx status, unexpected body) is logged
 * and reported as an empty result. Nothing here can affect the computed scores.
 */
@Component
public class ClaudeInsightClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeInsightClient.class);

    private static final int RISK_INSIGHTS_MAX_TOKENS = 1000;
    private static final int RECOMMENDATIONS_MAX_TOKENS = 800;

    @Value("${precare.external.insights.endpoint:https://api.anthropic.com/v1/messages}")
    private String endpoint;

    @Value("${precare.external.insights.api-key:}")
    private String apiKey;

    @Value("${precare.external.insights.model:claude-3-sonnet-20240229}")
    private String model;

    @Value("${precare.external.insights.anthropic-version:2023-06-01}")
    private String anthropicVersion;

    @Value("${precare.external.insights.temperature:0.1}")
    private double temperature;

    @Value("${precare.external.insights.timeout-ms:20000}")
    private long timeoutMs;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ClaudeInsightClient() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(5000))
                .build());
    }

    ClaudeInsightClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Clinical narrative over a complete result set.
     */
    public Optional<String> riskInsights(PatientRecord record, RiskResultSet results) {
        String prompt = InsightPromptBuilder.riskInsightsPrompt(record, results);
        return complete(prompt, RISK_INSIGHTS_MAX_TOKENS, "risk insights");
    }

    /**
     * Free-text prevention advice for one condition.
     */
    public Optional<String> personalizedRecommendations(PatientRecord record, String conditionName) {
        String recordJson;
        try {
            recordJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (Exception e) {
            log.warn("Could not serialize patient record for recommendations: {}", e.getMessage());
            return Optional.empty();
        }
        String prompt = InsightPromptBuilder.personalizedRecommendationsPrompt(recordJson, conditionName);
        return complete(prompt, RECOMMENDATIONS_MAX_TOKENS, "recommendations for " + conditionName);
    }

    private Optional<String> complete(String prompt, int maxTokens, String purpose) {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("No insights API key configured, skipping {}", purpose);
            return Optional.empty();
        }

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", anthropicVersion)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt, maxTokens), StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.warn("Insights API returned status {} for {}", response.statusCode(), purpose);
                return Optional.empty();
            }

            return extractText(response.body());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Insights request interrupted for {}", purpose);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Insights request failed for {}: {}", purpose, e.getMessage());
            return Optional.empty();
        }
    }

    private String requestBody(String prompt, int maxTokens) throws Exception {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);
        return objectMapper.writeValueAsString(body);
    }

    private Optional<String> extractText(String responseBody) throws Exception {
        JsonNode root = objectMapper.readTree(responseBody);
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                String text = block.path("text").asText(null);
                if (text != null && !text.isBlank()) {
                    return Optional.of(text.trim());
                }
            }
        }
        log.warn("Insights response carried no text content");
        return Optional.empty();
    }
}
