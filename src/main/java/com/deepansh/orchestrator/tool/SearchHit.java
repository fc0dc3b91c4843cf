package com.deepansh.orchestrator.tool;

/** One ranked result from the search backend. */
public record SearchHit(String name, String chunk, double score) {
}
