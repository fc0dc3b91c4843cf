package com.deepansh.orchestrator.core;

import java.util.List;

/**
 * Parsed intent classification.
 *
 * @param quickResponse  model says the query can be answered directly
 * @param standardAnswer the direct answer; only used when quickResponse is set
 * @param categories     workflow categories recognized for the query
 */
public record IntentVerdict(boolean quickResponse, String standardAnswer, List<String> categories) {

    public IntentVerdict {
        standardAnswer = standardAnswer == null ? "" : standardAnswer;
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /** Verdict used when the model output cannot be parsed: continue, no categories. */
    public static IntentVerdict fallback() {
        return new IntentVerdict(false, "", List.of());
    }

    public boolean shortCircuits() {
        return quickResponse && !standardAnswer.isBlank();
    }
}
