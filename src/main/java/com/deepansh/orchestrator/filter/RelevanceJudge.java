package com.deepansh.orchestrator.filter;

import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.model.ChunkScore;
import com.deepansh.orchestrator.stream.ResponseSections;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the per-chunk relevance prompt and turns the model's reply into a
 * {@link ChunkScore}.
 *
 * Relevant means the answer contains the positive keyword and not the
 * negative one (case-insensitive). The score comes from "SCORE: nn" or,
 * failing that, {"score": nn}; without either it defaults by verdict.
 */
public class RelevanceJudge {

    private static final Pattern SCORE_LINE = Pattern.compile("SCORE\\s*:\\s*(\\d{1,3})", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCORE_JSON = Pattern.compile("\\{\\s*\"score\"\\s*:\\s*(\\d{1,3})\\s*\\}");

    private final AgentProperties.Filter config;

    public RelevanceJudge(AgentProperties.Filter config) {
        this.config = config;
    }

    public String prompt(String query, String chunk) {
        return """
                Decide whether the document chunk helps answer the question.
                Reply with %s or %s on the first line, then SCORE: <0-100> on the second line.

                Question: %s

                Chunk:
                %s
                """.formatted(config.getPositiveKeyword(), config.getNegativeKeyword(), query, chunk);
    }

    public ChunkScore judge(String chunk, String modelOutput) {
        String answer = ResponseSections.answerBody(modelOutput);
        boolean relevant = isRelevant(answer);
        int score = extractScore(answer).orElse(
                relevant ? config.getRelevantDefaultScore() : config.getIrrelevantDefaultScore());
        return new ChunkScore(chunk, relevant, score);
    }

    /** Verdict for a chunk whose model call failed: kept, with the neutral score. */
    public ChunkScore fallback(String chunk) {
        return new ChunkScore(chunk, true, config.getFallbackScore());
    }

    boolean isRelevant(String answer) {
        String upper = answer.toUpperCase(Locale.ROOT);
        return upper.contains(config.getPositiveKeyword().toUpperCase(Locale.ROOT))
                && !upper.contains(config.getNegativeKeyword().toUpperCase(Locale.ROOT));
    }

    Optional<Integer> extractScore(String answer) {
        Matcher line = SCORE_LINE.matcher(answer);
        if (line.find()) return Optional.of(Integer.parseInt(line.group(1)));
        Matcher json = SCORE_JSON.matcher(answer);
        if (json.find()) return Optional.of(Integer.parseInt(json.group(1)));
        return Optional.empty();
    }
}
