package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ReasoningStep;
import com.deepansh.orchestrator.model.RecognizedEntity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SessionContextTest {

    @Test
    @SuppressWarnings("unchecked")
    void copyForBranch_deepCopiesMemoryAndMetadata() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("tags", new ArrayList<>(List.of("a")));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("device", nested);
        SessionContext parent = new SessionContext("run-1", "s-1", "query",
                List.of(Message.user("hello")), metadata);

        SessionContext branch = parent.copyForBranch("fault-analysis");
        branch.getMemory().get(0).setContent("changed");
        ((List<Object>) ((Map<String, Object>) branch.getMetadata().get("device")).get("tags")).add("b");

        assertThat(parent.getMemory().get(0).getContent()).isEqualTo("hello");
        assertThat((List<Object>) ((Map<String, Object>) parent.getMetadata().get("device")).get("tags"))
                .containsExactly("a");
        assertThat(branch.getCategory()).isEqualTo("fault-analysis");
    }

    @Test
    void copyForBranch_startsWithEmptyTraceSourcesAndPlan() {
        SessionContext parent = new SessionContext("run-1", "s-1", "query", List.of(), Map.of());
        parent.setPlan("1. inspect");
        parent.appendStep(new ReasoningStep.Observation("seen"));
        parent.addSource("doc-1");
        parent.setCachedChunks(List.of("chunk"));
        parent.setCategories(List.of("a", "b"));
        parent.setEntities(List.of(RecognizedEntity.builder().deviceName("Pump-7").build()));

        SessionContext branch = parent.copyForBranch("a");

        assertThat(branch.getPlan()).isEmpty();
        assertThat(branch.getReasoning()).isEmpty();
        assertThat(branch.getSources()).isEmpty();
        assertThat(branch.getCachedChunks()).isEmpty();
        assertThat(branch.getCategories()).containsExactly("a", "b");
        assertThat(branch.getEntities()).hasSize(1);
        assertThat(branch.getEntities().get(0)).isNotSameAs(parent.getEntities().get(0));
    }

    @Test
    void addSource_skipsBlankValues() {
        SessionContext ctx = new SessionContext("r", "s", "q", List.of(), Map.of());

        ctx.addSources(List.of("doc", " ", ""));
        ctx.addSource(null);

        assertThat(ctx.getSources()).containsExactly("doc");
    }

    @Test
    void lastUserMessage_prefersLatestUserTurn() {
        SessionContext ctx = new SessionContext("r", "s", "raw input",
                List.of(Message.user("first"), Message.assistant("reply")), Map.of());
        assertThat(ctx.lastUserMessage()).isEqualTo("first");

        ctx.addMessage(Message.user("second"));
        assertThat(ctx.lastUserMessage()).isEqualTo("second");

        SessionContext empty = new SessionContext("r", "s", "raw input", List.of(), Map.of());
        assertThat(empty.lastUserMessage()).isEqualTo("raw input");
    }

    @Test
    void reasoningSnapshot_isDetachedFromLiveTrace() {
        SessionContext ctx = new SessionContext("r", "s", "q", List.of(), Map.of());
        ctx.appendStep(new ReasoningStep.Observation("one"));

        List<ReasoningStep> snapshot = ctx.reasoningSnapshot();
        ctx.appendStep(new ReasoningStep.Observation("two"));

        assertThat(snapshot).hasSize(1);
        assertThat(ctx.getReasoning()).hasSize(2);
    }
}
