package com.deepansh.orchestrator.filter;

import com.deepansh.orchestrator.model.ChunkScore;

import java.util.Comparator;
import java.util.List;

/**
 * Every chunk's verdict, in input order. Each input chunk appears exactly once.
 */
public record FilterOutcome(List<ChunkScore> scores) {

    public FilterOutcome {
        scores = List.copyOf(scores);
    }

    public static FilterOutcome empty() {
        return new FilterOutcome(List.of());
    }

    /** Relevant chunk texts, highest score first; equal scores keep input order. */
    public List<String> relevantChunks() {
        return scores.stream()
                .filter(ChunkScore::relevant)
                .sorted(Comparator.comparingInt(ChunkScore::score).reversed())
                .map(ChunkScore::chunk)
                .toList();
    }

    public int relevantCount() {
        return (int) scores.stream().filter(ChunkScore::relevant).count();
    }

    public int total() {
        return scores.size();
    }
}
