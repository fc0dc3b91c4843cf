package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.model.Message;

import java.util.List;
import java.util.function.Consumer;

/**
 * Model provider seam. The returned text may carry the section markers
 * defined in {@link com.deepansh.orchestrator.stream.ResponseSections}.
 */
public interface LlmClient {

    /** Single-prompt, non-streaming call. */
    String complete(String prompt);

    /**
     * Streams a chat completion, handing each delta to {@code onDelta} as it
     * arrives, and returns the full text once the stream ends.
     */
    String streamChat(List<Message> messages, Consumer<String> onDelta);

    default String chat(List<Message> messages) {
        return streamChat(messages, delta -> { });
    }
}
