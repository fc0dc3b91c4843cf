package com.deepansh.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the append-only reasoning trace.
 *
 * Closed set of variants. Consumers go through {@link Visitor} so that adding
 * a variant breaks every site that has not handled it.
 */
public sealed interface ReasoningStep
        permits ReasoningStep.Action, ReasoningStep.Observation,
                ReasoningStep.Milestone, ReasoningStep.Final {

    <R> R accept(Visitor<R> visitor);

    /** Text form used in prompts and aggregated output. */
    String render();

    interface Visitor<R> {
        R action(Action action);
        R observation(Observation observation);
        R milestone(Milestone milestone);
        R fin(Final fin);
    }

    record Action(String thought, String name, Map<String, Object> args) implements ReasoningStep {
        public Action {
            args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.action(this);
        }

        @Override
        public String render() {
            String prefix = thought == null || thought.isBlank() ? "" : "Thought: " + thought + "\n";
            return prefix + "Action: " + name + "\nAction Input: " + args;
        }
    }

    record Observation(String text) implements ReasoningStep {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.observation(this);
        }

        @Override
        public String render() {
            return "Observation: " + text;
        }
    }

    record Milestone(String thought, String note) implements ReasoningStep {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.milestone(this);
        }

        @Override
        public String render() {
            return "Thought: " + thought + "\nMilestone: " + note;
        }
    }

    record Final(String thought, String text) implements ReasoningStep {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.fin(this);
        }

        @Override
        public String render() {
            String prefix = thought == null || thought.isBlank() ? "" : "Thought: " + thought + "\n";
            return prefix + "Answer: " + text;
        }
    }
}
