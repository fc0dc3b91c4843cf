package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.ToolProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes raw tool output for the reasoning loop.
 *
 * Search results are parsed into ranked hits: a JSON array of
 * {name, chunk, score}, or an object wrapping such an array under
 * results/hits/chunks/data. A hit's chunk may be a string or a list of
 * strings; each becomes its own chunk.
 *
 * Search output that does not parse is passed on verbatim as a single chunk
 * and flagged as a raw fallback. Everything else is a plain observation.
 */
@Component
@Slf4j
public class ToolResultNormalizer {

    private static final List<String> WRAPPER_FIELDS = List.of("results", "hits", "chunks", "data");

    private final ToolProperties properties;
    private final ObjectMapper objectMapper;

    public ToolResultNormalizer(ToolProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ToolOutput normalize(String toolName, String raw) {
        if (!properties.getSearchTool().equals(toolName) || isToolError(raw)) {
            return ToolOutput.text(raw);
        }

        List<SearchHit> hits = parseHits(raw);
        if (hits == null) {
            // TODO: decide whether unparsable search output should be rejected instead of kept verbatim
            log.warn("Search output is not a hit list, keeping it as one raw chunk [chars={}]",
                    raw == null ? 0 : raw.length());
            return ToolOutput.rawChunk(raw);
        }

        List<String> chunks = new ArrayList<>();
        hits.forEach(hit -> chunks.add(hit.chunk()));
        log.debug("Parsed {} search hits", hits.size());
        return ToolOutput.chunks(chunks);
    }

    /** Null when the text is not a recognizable hit list. */
    List<SearchHit> parseHits(String raw) {
        if (raw == null || raw.isBlank()) return null;
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return null;
        }

        JsonNode items = root;
        if (root.isObject()) {
            items = null;
            for (String field : WRAPPER_FIELDS) {
                if (root.path(field).isArray()) {
                    items = root.get(field);
                    break;
                }
            }
            if (items == null && root.has("chunk")) {
                items = objectMapper.createArrayNode().add(root);
            }
        }
        if (items == null || !items.isArray()) return null;

        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isTextual()) {
                hits.add(new SearchHit("", item.asText(), 0));
                continue;
            }
            String name = item.path("name").asText("");
            double score = item.path("score").asDouble(0);
            JsonNode chunk = item.path("chunk");
            if (chunk.isArray()) {
                chunk.forEach(part -> hits.add(new SearchHit(name, part.asText(), score)));
            } else if (!chunk.isMissingNode() && !chunk.isNull()) {
                hits.add(new SearchHit(name, chunk.asText(), score));
            }
        }
        return hits;
    }

    private static boolean isToolError(String raw) {
        return raw != null && raw.startsWith("ERROR:");
    }
}
