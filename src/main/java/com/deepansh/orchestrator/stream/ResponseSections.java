package com.deepansh.orchestrator.stream;

/**
 * Static helpers over complete model responses.
 *
 * Two independent marker pairs exist:
 * - section markers written by {@code GenericLlmClient} around the reasoning
 *   and answer parts of a streamed response
 * - literal {@code <think>...</think>} tags some models emit inline
 */
public final class ResponseSections {

    public static final String THINKING_MARKER = "\n" + "=".repeat(20) + "思考过程" + "=".repeat(20) + "\n";
    public static final String ANSWER_MARKER = "\n" + "=".repeat(20) + "完整回复" + "=".repeat(20) + "\n";

    private static final String THINK_OPEN = "<think>";
    private static final String THINK_CLOSE = "</think>";

    private ResponseSections() {
    }

    /**
     * Everything after the last answer marker, or the whole text when there is none.
     * Applying it to its own output returns the output unchanged.
     */
    public static String extractFinalContent(String fullText) {
        if (fullText == null) return "";
        int at = fullText.lastIndexOf(ANSWER_MARKER);
        return at < 0 ? fullText : fullText.substring(at + ANSWER_MARKER.length());
    }

    /** Text between the thinking marker and the answer marker, or "" when not sectioned. */
    public static String extractThinkingSection(String fullText) {
        if (fullText == null) return "";
        int start = fullText.indexOf(THINKING_MARKER);
        if (start < 0) return "";
        start += THINKING_MARKER.length();
        int end = fullText.indexOf(ANSWER_MARKER, start);
        return (end < 0 ? fullText.substring(start) : fullText.substring(start, end)).strip();
    }

    /** Text after the last {@code </think>}, stripped; the original text when the tag is absent. */
    public static String extractAnswer(String fullText) {
        if (fullText == null) return "";
        int at = fullText.lastIndexOf(THINK_CLOSE);
        return at < 0 ? fullText : fullText.substring(at + THINK_CLOSE.length()).strip();
    }

    /** Text between the first {@code <think>} and {@code </think>}, stripped; "" when either tag is absent. */
    public static String extractThinking(String fullText) {
        if (fullText == null) return "";
        int open = fullText.indexOf(THINK_OPEN);
        int close = fullText.indexOf(THINK_CLOSE);
        if (open < 0 || close < 0) return "";
        int start = open + THINK_OPEN.length();
        return close < start ? "" : fullText.substring(start, close).strip();
    }

    /**
     * The model's answer with both marker styles removed:
     * final section first, then anything after an inline think block.
     */
    public static String answerBody(String fullText) {
        return extractAnswer(extractFinalContent(fullText));
    }
}
