package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.RecognizedEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds recognized entities into request metadata.
 *
 * Caller-supplied values win: dev_name is only filled when missing, blank or
 * the literal "null", fault_type1 only when missing or blank. Every entity is
 * also summarised into recognized_entities for the prompt context.
 */
public class EntityMetadataMerger {

    static final String DEV_NAME = "dev_name";
    static final String FAULT_TYPE = "fault_type1";
    static final String RECOGNIZED = "recognized_entities";

    public Map<String, Object> merge(Map<String, Object> metadata, List<RecognizedEntity> entities) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        if (entities == null || entities.isEmpty()) return merged;

        List<String> summaries = new ArrayList<>();
        for (RecognizedEntity entity : entities) {
            if (hasText(entity.getDeviceName()) && isUnset(merged.get(DEV_NAME), true)) {
                merged.put(DEV_NAME, entity.getDeviceName());
            }
            if (hasText(entity.getFaultType()) && isUnset(merged.get(FAULT_TYPE), false)) {
                merged.put(FAULT_TYPE, entity.getFaultType());
            }
            String summary = summarise(entity);
            if (!summary.isEmpty()) summaries.add(summary);
        }

        if (!summaries.isEmpty()) {
            merged.put(RECOGNIZED, summaries);
        }
        return merged;
    }

    private static String summarise(RecognizedEntity entity) {
        List<String> parts = new ArrayList<>();
        if (hasText(entity.getDeviceName())) parts.add("device name: " + entity.getDeviceName());
        if (hasText(entity.getDeviceType())) parts.add("device type: " + entity.getDeviceType());
        if (hasText(entity.getFaultType())) parts.add("fault type: " + entity.getFaultType());
        if (hasText(entity.getVoltageLevel())) parts.add("voltage level: " + entity.getVoltageLevel());
        return String.join(", ", parts);
    }

    private static boolean isUnset(Object value, boolean nullLiteral) {
        if (value == null) return true;
        String text = value.toString();
        return text.isBlank() || (nullLiteral && "null".equals(text));
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
