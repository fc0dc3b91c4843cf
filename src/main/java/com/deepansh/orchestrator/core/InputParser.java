package com.deepansh.orchestrator.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unpacks the raw request text.
 *
 * Supported forms:
 * - plain text
 * - {"input": "...", "metadata": {...}, "attachments": [...]}
 * - {"query": "...", "metadata": {...}} (query form needs metadata or attachments;
 *   "input" wins when both are present)
 * - legacy event payloads: faultDescr, occurTime, faultId, devId, devName
 *
 * Anything that is not a JSON object is plain text.
 */
@Slf4j
public class InputParser {

    static final DateTimeFormatter EVENT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public InputParser(ObjectMapper objectMapper) {
        this(objectMapper, ZoneId.systemDefault());
    }

    public InputParser(ObjectMapper objectMapper, ZoneId zone) {
        this.objectMapper = objectMapper;
        this.zone = zone;
    }

    public ParsedInput parse(String raw) {
        if (raw == null) return ParsedInput.plain("");
        String text = raw.strip();
        if (!text.startsWith("{")) return ParsedInput.plain(raw);

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Input looks like JSON but does not parse, treating as text: {}", e.getOriginalMessage());
            return ParsedInput.plain(raw);
        }
        if (root == null || !root.isObject()) return ParsedInput.plain(raw);

        if (root.has("input")) {
            return new ParsedInput(text(root.get("input")), metadataOf(root), attachmentsOf(root));
        }
        if (root.has("metadata") || root.has("attachments")) {
            // {"query": ..., "metadata": ...}
            return new ParsedInput(text(root.get("query")), metadataOf(root), attachmentsOf(root));
        }
        return legacy(root);
    }

    private ParsedInput legacy(JsonNode root) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "event_time", formatEventTime(text(root.get("occurTime"))));
        putIfPresent(metadata, "event_id", text(root.get("faultId")));
        putIfPresent(metadata, "source_device_id", text(root.get("devId")));
        putIfPresent(metadata, "source_device_name", text(root.get("devName")));
        return new ParsedInput(text(root.get("faultDescr")), metadata, attachmentsOf(root));
    }

    /**
     * Keeps values already in yyyy-MM-dd HH:mm:ss, formats 10-digit (seconds) and
     * 13-digit (milliseconds) epoch values in the parser's zone, and returns
     * anything else unchanged.
     */
    String formatEventTime(String value) {
        if (value == null || value.isBlank()) return "";
        if (isFormatted(value) || !value.matches("\\d+")) return value;
        try {
            long epoch = Long.parseLong(value);
            Instant instant = value.length() == 13 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
            return EVENT_TIME.format(instant.atZone(zone));
        } catch (RuntimeException e) {
            return value;
        }
    }

    private static boolean isFormatted(String value) {
        try {
            LocalDateTime.parse(value, EVENT_TIME);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private Map<String, Object> metadataOf(JsonNode root) {
        JsonNode node = root.get("metadata");
        if (node == null || !node.isObject()) return new LinkedHashMap<>();
        return objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private List<Object> attachmentsOf(JsonNode root) {
        JsonNode node = root.get("attachments");
        if (node == null || !node.isArray()) return new ArrayList<>();
        return objectMapper.convertValue(node, new TypeReference<List<Object>>() {});
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null && !value.isBlank()) target.put(key, value);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) return "";
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
