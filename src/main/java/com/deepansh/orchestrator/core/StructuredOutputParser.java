package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.RecognizedEntity;
import com.deepansh.orchestrator.stream.ResponseSections;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the JSON verdicts of the intent and entity models.
 *
 * Both accept a bare JSON document or one wrapped in a ```json fence, after
 * the answer section has been cut out of the model output. Malformed output
 * never fails the run: intent falls back to "continue, no categories" and
 * entities fall back to an empty list.
 */
@Slf4j
public class StructuredOutputParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final String defaultCategory;

    public StructuredOutputParser(ObjectMapper objectMapper, String defaultCategory) {
        this.objectMapper = objectMapper;
        this.defaultCategory = defaultCategory;
    }

    public IntentVerdict parseIntent(String modelOutput) {
        String json = extractJson(ResponseSections.answerBody(modelOutput));
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                log.warn("Intent output is not a JSON object, continuing without categories");
                return IntentVerdict.fallback();
            }
            boolean quick = root.path("is_quick_response").asBoolean(false);
            String answer = root.path("standard_answer").asText("");

            List<String> categories = new ArrayList<>();
            JsonNode listed = root.get("workflow_categories");
            if (listed == null || listed.isNull()) {
                categories.add(defaultCategory);
            } else if (listed.isArray()) {
                listed.forEach(c -> {
                    if (!c.asText().isBlank()) categories.add(c.asText().strip());
                });
            } else if (!listed.asText().isBlank()) {
                categories.add(listed.asText().strip());
            }
            return new IntentVerdict(quick, answer, categories);

        } catch (JsonProcessingException e) {
            log.warn("Intent output is not valid JSON, continuing without categories: {}", e.getOriginalMessage());
            return IntentVerdict.fallback();
        }
    }

    /** A single object is treated as a one-element list; anything else yields an empty list. */
    public List<RecognizedEntity> parseEntities(String modelOutput) {
        String json = extractJson(ResponseSections.answerBody(modelOutput));
        try {
            JsonNode root = objectMapper.readTree(json);
            List<RecognizedEntity> entities = new ArrayList<>();
            if (root == null) return entities;
            if (root.isObject()) {
                entities.add(objectMapper.treeToValue(root, RecognizedEntity.class));
            } else if (root.isArray()) {
                for (JsonNode item : root) {
                    if (item.isObject()) entities.add(objectMapper.treeToValue(item, RecognizedEntity.class));
                }
            }
            return entities;
        } catch (JsonProcessingException e) {
            log.warn("Entity output is not valid JSON, using no entities: {}", e.getOriginalMessage());
            return new ArrayList<>();
        }
    }

    static String extractJson(String text) {
        if (text == null) return "";
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            return fenced.group(1).strip();
        }
        return text.strip();
    }
}
