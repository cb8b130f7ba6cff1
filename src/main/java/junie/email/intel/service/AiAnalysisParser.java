package junie.email.intel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import junie.email.intel.entity.AiAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the structured analysis out of the model's reply.
 * Expected shape: {@code {category, priority, summary, action_items, confidence}}.
 */
@Component
public class AiAnalysisParser {
    private final ObjectMapper objectMapper;

    public AiAnalysisParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException when the reply is not usable; the caller treats this as a failed attempt
     */
    public AiAnalysis parse(String content) {
        JsonNode json;
        try {
            json = objectMapper.readTree(stripFences(content));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("AI reply is not valid JSON", e);
        }
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("AI reply is not a JSON object");
        }

        JsonNode priority = json.get("priority");
        if (priority == null || !priority.isNumber() || priority.asInt() < 1 || priority.asInt() > 10) {
            throw new IllegalArgumentException("Invalid priority returned: " + priority);
        }

        List<String> actionItems = new ArrayList<>();
        JsonNode items = json.path("action_items");
        if (items.isArray()) {
            items.forEach(item -> {
                if (!item.asText("").isBlank()) {
                    actionItems.add(item.asText().trim());
                }
            });
        } else if (items.isTextual() && !items.asText().isBlank()) {
            actionItems.add(items.asText().trim());
        }

        double confidence = json.path("confidence").asDouble(0.5);
        return AiAnalysis.builder()
                .category(json.path("category").asText("uncategorized"))
                .priority(priority.asInt())
                .summary(json.path("summary").asText(""))
                .actionItems(String.join("\n", actionItems))
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .build();
    }

    private static String stripFences(String content) {
        if (content == null) {
            return "";
        }
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
