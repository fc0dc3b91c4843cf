package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ToolCall;

import java.util.List;

/**
 * Typed events passed between workflow steps. Each step consumes one event
 * and returns the next; {@link Stop} is terminal.
 */
public sealed interface WorkflowEvent {

    /** Name of the step that consumes this event, as reported to observers. */
    String step();

    record Start(String query) implements WorkflowEvent {
        public String step() { return "new_user_msg"; }
    }

    record IntentCheck(String query) implements WorkflowEvent {
        public String step() { return "intent_recognition"; }
    }

    record EntityExtract(String query) implements WorkflowEvent {
        public String step() { return "entity_recognition"; }
    }

    record PlanGate(List<String> categories) implements WorkflowEvent {
        public PlanGate {
            categories = List.copyOf(categories);
        }

        public String step() { return "check_valid_plan"; }
    }

    record GeneratePlan(String query) implements WorkflowEvent {
        public String step() { return "generate_plan"; }
    }

    record PrepareHistory() implements WorkflowEvent {
        public String step() { return "prepare_chat_history"; }
    }

    record ReasonInput(List<Message> history) implements WorkflowEvent {
        public ReasonInput {
            history = List.copyOf(history);
        }

        public String step() { return "llm_reasoning"; }
    }

    record ToolDispatch(ToolCall call) implements WorkflowEvent {
        public String step() { return "tool_call"; }
    }

    record FanOut(List<String> categories) implements WorkflowEvent {
        public FanOut {
            categories = List.copyOf(categories);
        }

        public String step() { return "parallel_execution"; }
    }

    record Stop(StopReason reason, String response) implements WorkflowEvent {
        public String step() { return "stop"; }
    }

    enum StopReason {
        FINAL, QUICK_RESPONSE, MAX_ITERATIONS, FAN_OUT
    }
}
