package com.deepansh.orchestrator.stream;

public enum ContentType {
    THINKING, OUTPUT;

    public String label() {
        return this == THINKING ? "thinking" : "output";
    }
}
