package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.exception.ReasoningParseException;
import com.deepansh.orchestrator.model.ReasoningStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses one ReAct turn into a {@link ReasoningStep}.
 *
 * Accepted shapes, checked in this order:
 * <pre>
 * Thought: ...
 * Action: tool_name
 * Action Input: {"key": "value"}
 *
 * Thought: ...
 * Answer: ...
 *
 * Thought: ...
 * Milestone: ...
 * </pre>
 * Text without any "Thought:" is taken as a direct answer.
 */
public class ReasoningStepParser {

    static final String IMPLICIT_THOUGHT = "(Implicit) I can answer without any more tools!";

    private static final Pattern ACTION = Pattern.compile(
            "(?s)(?:Thought:\\s*(.*?))?\\s*Action:\\s*([^\\n]+?)\\s*\\n\\s*Action Input:\\s*(.*)");
    private static final Pattern ANSWER = Pattern.compile("(?s)(?:Thought:\\s*(.*?))?\\s*Answer:\\s*(.*)");
    private static final Pattern MILESTONE = Pattern.compile("(?s)(?:Thought:\\s*(.*?))?\\s*Milestone:\\s*(.*)");

    private final ObjectMapper objectMapper;

    public ReasoningStepParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReasoningStep parse(String output) {
        String text = output == null ? "" : output.strip();
        if (text.isEmpty()) {
            throw new ReasoningParseException("Empty model output");
        }

        if (text.contains("Action:")) {
            Matcher m = ACTION.matcher(text);
            if (!m.find()) {
                throw new ReasoningParseException("Action without Action Input in: " + abbreviate(text));
            }
            return new ReasoningStep.Action(strip(m.group(1)), m.group(2).strip(), parseInput(m.group(3)));
        }

        if (text.contains("Answer:")) {
            Matcher m = ANSWER.matcher(text);
            if (m.find()) return new ReasoningStep.Final(strip(m.group(1)), m.group(2).strip());
        }

        if (text.contains("Milestone:")) {
            Matcher m = MILESTONE.matcher(text);
            if (m.find()) return new ReasoningStep.Milestone(strip(m.group(1)), m.group(2).strip());
        }

        if (!text.contains("Thought:")) {
            return new ReasoningStep.Final(IMPLICIT_THOUGHT, text);
        }
        throw new ReasoningParseException("Could not parse output: " + abbreviate(text));
    }

    private Map<String, Object> parseInput(String raw) {
        int open = raw.indexOf('{');
        int close = raw.lastIndexOf('}');
        if (open < 0 || close < open) {
            throw new ReasoningParseException("Action Input is not a JSON object: " + abbreviate(raw));
        }
        try {
            return objectMapper.readValue(raw.substring(open, close + 1), new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new ReasoningParseException("Action Input is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String strip(String s) {
        return s == null ? "" : s.strip();
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
