package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.ReasoningStep;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prompt templates for every model call the workflow makes.
 * Kept deliberately short: they only pin the output format each step parses.
 */
public class PromptFormatter {

    public String intent(String query, Collection<String> knownCategories) {
        return """
                Decide how to handle the user request below.

                If it is small talk or can be answered reliably in one or two sentences without \
                looking anything up, set is_quick_response to true and put the answer in standard_answer.
                Otherwise set is_quick_response to false and list every workflow category that applies.

                Known workflow categories: %s

                Reply with JSON only:
                {"is_quick_response": false, "standard_answer": "", "workflow_categories": ["..."]}

                User request:
                %s
                """.formatted(String.join(", ", knownCategories), query);
    }

    public String entities(String query) {
        return """
                Extract the devices and faults mentioned in the request below.
                Reply with a JSON array only, one object per entity:
                [{"device_name": "", "device_type": "", "fault_type": "", "voltage_level": ""}]
                Use an empty array when nothing is mentioned.

                Request:
                %s
                """.formatted(query);
    }

    public String planning(String query, String template, String examplePlan, String tools,
                           Map<String, Object> metadata) {
        StringBuilder prompt = new StringBuilder("""
                Write a short numbered plan for answering the request below with the available tools.
                Output the plan only.

                Request:
                %s

                Available tools:
                %s

                Context:
                %s
                """.formatted(query, tools, metadataBlock(metadata)));
        if (template != null && !template.isBlank()) {
            prompt.append("\nFollow this workflow:\n").append(template.strip()).append('\n');
        }
        if (examplePlan != null && !examplePlan.isBlank()) {
            prompt.append("\nA plan that worked for the same request before:\n").append(examplePlan.strip()).append('\n');
        }
        return prompt.toString();
    }

    public String planUpdate(String plan, List<ReasoningStep> trace, String query) {
        return """
                Update the plan below given the progress made so far. Mark finished steps as done \
                and adjust the remaining ones. Output the updated plan only.

                Request:
                %s

                Current plan:
                %s

                Progress:
                %s
                """.formatted(query, plan, renderTrace(trace));
    }

    public String reactSystem(String tools, String plan, Map<String, Object> metadata) {
        String planBlock = plan == null || plan.isBlank() ? "(no plan)" : plan.strip();
        return """
                You are a careful assistant that solves the user's request step by step with tools.

                ## Tools
                %s

                ## Plan
                %s

                ## Context
                %s

                ## Output format
                Answer in exactly one of these forms.

                To use a tool:
                Thought: what you need and why
                Action: tool name
                Action Input: tool arguments as a JSON object

                To record progress without a tool:
                Thought: what you concluded
                Milestone: the plan step you finished

                To finish:
                Thought: I can answer without using any more tools.
                Answer: the final answer
                """.formatted(tools, planBlock, metadataBlock(metadata));
    }

    static String metadataBlock(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return "none";
        return metadata.entrySet().stream()
                .map(e -> "- " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    static String renderTrace(List<ReasoningStep> trace) {
        if (trace.isEmpty()) return "(nothing yet)";
        return trace.stream().map(ReasoningStep::render).collect(Collectors.joining("\n"));
    }
}
