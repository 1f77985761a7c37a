package com.longevitydigest.backend.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.longevitydigest.backend.model.dto.FactCheckVerdict;
import com.longevitydigest.backend.model.dto.GeneratedContent;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw model output into structured content.
 * <p>
 * Model output is often wrapped in a markdown code fence or surrounded by prose, so the
 * parser strips the fence first and otherwise reads the first well-formed JSON object.
 */
@Slf4j
@Component
public class AiResponseParser {

    public static final int MAX_INSIGHTS = 3;
    public static final int MAX_APPLICATIONS = 3;
    private static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*\\n?");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\n?```\\s*$");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse a generation or revision response
     *
     * @throws MalformedResponseException when no object is found or title/body are missing
     */
    public GeneratedContent parseContent(String response) {
        JsonNode root = readObject(response);

        String title = text(root, "title");
        String body = text(root, "body");
        if (title == null || title.isBlank() || body == null || body.isBlank()) {
            throw new MalformedResponseException("Generated content is missing title or body");
        }

        return GeneratedContent.builder()
                .title(title)
                .summary(text(root, "summary"))
                .body(body)
                .keyInsights(stringList(root.get("key_insights"), MAX_INSIGHTS))
                .practicalApplications(stringList(root.get("practical_applications"), MAX_APPLICATIONS))
                .confidenceScore(confidence(root.get("confidence_score")))
                .build();
    }

    /**
     * Parse a revision response; unlike generation, absent fields are left null so the
     * current draft values survive
     */
    public GeneratedContent parseRevision(String response) {
        JsonNode root = readObject(response);
        JsonNode confidenceNode = root.get("confidence_score");

        return GeneratedContent.builder()
                .title(text(root, "title"))
                .summary(text(root, "summary"))
                .body(text(root, "body"))
                .keyInsights(stringList(root.get("key_insights"), MAX_INSIGHTS))
                .practicalApplications(stringList(root.get("practical_applications"), MAX_APPLICATIONS))
                .confidenceScore(confidenceNode != null && !confidenceNode.isNull() ? confidence(confidenceNode) : null)
                .build();
    }

    /**
     * Parse a fact-check response
     *
     * @throws MalformedResponseException when no object is found
     */
    public FactCheckVerdict parseVerdict(String response) {
        JsonNode root = readObject(response);

        JsonNode safe = root.get("safe_to_publish");
        return FactCheckVerdict.builder()
                .accuracyScore(clamp(root.path("accuracy_score").asDouble(0.0)))
                .issues(stringList(root.get("issues"), Integer.MAX_VALUE))
                .suggestions(stringList(root.get("suggestions"), Integer.MAX_VALUE))
                .safeToPublish(safe != null && (safe.isBoolean() ? safe.booleanValue() : "true".equalsIgnoreCase(safe.asText())))
                .build();
    }

    JsonNode readObject(String response) {
        if (response == null || response.isBlank()) {
            throw new MalformedResponseException("Empty AI response");
        }

        String cleaned = TRAILING_FENCE.matcher(LEADING_FENCE.matcher(response.trim()).replaceFirst("")).replaceFirst("");

        try {
            JsonNode node = objectMapper.readTree(cleaned);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (Exception e) {
            log.debug("Response is not plain JSON, searching for embedded object: {}", e.getMessage());
        }

        // Try each '{' in turn; readTree stops after the first complete value
        int start = cleaned.indexOf('{');
        while (start >= 0) {
            try {
                JsonNode node = objectMapper.readTree(cleaned.substring(start));
                if (node != null && node.isObject()) {
                    return node;
                }
            } catch (Exception e) {
                // keep scanning
                log.trace("No JSON object at offset {}", start);
            }
            start = cleaned.indexOf('{', start + 1);
        }

        throw new MalformedResponseException("AI response was not valid JSON: "
                + cleaned.substring(0, Math.min(200, cleaned.length())));
    }

    private String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) return null;
        return node.asText().trim();
    }

    private List<String> stringList(JsonNode node, int limit) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (values.size() >= limit) break;
                String value = item.asText().trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        } else if (!node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }

    private double confidence(JsonNode node) {
        if (node == null || node.isNull()) return DEFAULT_CONFIDENCE;
        if (node.isNumber()) return clamp(node.asDouble());
        try {
            return clamp(Double.parseDouble(node.asText().trim()));
        } catch (NumberFormatException e) {
            return DEFAULT_CONFIDENCE;
        }
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
