package com.deepansh.orchestrator.model;

/**
 * Relevance verdict for one document chunk. Score is always within [0, 100].
 */
public record ChunkScore(String chunk, boolean relevant, int score) {

    public ChunkScore {
        score = Math.max(0, Math.min(100, score));
    }
}
