package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ReasoningStep;
import com.deepansh.orchestrator.model.RecognizedEntity;
import com.deepansh.orchestrator.model.WorkflowResult;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state threaded through one workflow run.
 *
 * Owned by exactly one engine instance and only touched from the thread
 * driving it. Branches never share an instance: {@link #copyForBranch}
 * deep-copies the inputs a branch needs and starts it with an empty trace,
 * empty sources and no plan.
 */
@Getter
public class SessionContext {

    private final String runId;
    private final String sessionId;
    private final List<Message> memory;
    private final List<ReasoningStep> reasoning = new ArrayList<>();
    private final List<String> sources = new ArrayList<>();
    private final Map<String, Object> metadata;

    @Setter private String userInput;
    @Setter private String plan = "";
    @Setter private String category;
    @Setter private String template = "";
    private List<String> categories = new ArrayList<>();
    private List<RecognizedEntity> entities = new ArrayList<>();
    private List<String> cachedChunks = new ArrayList<>();
    private Map<String, WorkflowResult> branchResults = new LinkedHashMap<>();
    private int iterations;
    private boolean stopped;

    public SessionContext(String runId, String sessionId, String userInput,
                          List<Message> memory, Map<String, Object> metadata) {
        this.runId = runId;
        this.sessionId = sessionId;
        this.userInput = userInput;
        this.memory = new ArrayList<>(memory != null ? memory : List.of());
        this.metadata = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
    }

    /**
     * A fresh context for one category branch. Memory, entities, metadata,
     * categories and user input are deep-copied; trace, sources, plan and
     * cached chunks start empty.
     */
    public SessionContext copyForBranch(String branchCategory) {
        List<Message> memoryCopy = new ArrayList<>();
        memory.forEach(m -> memoryCopy.add(m.copy()));

        SessionContext copy = new SessionContext(runId, sessionId, userInput, memoryCopy, deepCopy(metadata));
        copy.category = branchCategory;
        copy.categories = new ArrayList<>(categories);
        entities.forEach(e -> copy.entities.add(RecognizedEntity.builder()
                .deviceName(e.getDeviceName())
                .deviceType(e.getDeviceType())
                .faultType(e.getFaultType())
                .voltageLevel(e.getVoltageLevel())
                .build()));
        return copy;
    }

    public void appendStep(ReasoningStep step) {
        reasoning.add(step);
    }

    public void addSource(String source) {
        if (source != null && !source.isBlank()) sources.add(source);
    }

    public void addSources(List<String> items) {
        items.forEach(this::addSource);
    }

    public void addMessage(Message message) {
        memory.add(message);
    }

    /** Content of the latest user turn, falling back to the raw user input. */
    public String lastUserMessage() {
        for (int i = memory.size() - 1; i >= 0; i--) {
            if (memory.get(i).getRole() == Message.Role.user) return memory.get(i).getContent();
        }
        return userInput;
    }

    public void replaceMetadata(Map<String, Object> merged) {
        metadata.clear();
        metadata.putAll(merged);
    }

    public void setCategories(List<String> categories) {
        this.categories = new ArrayList<>(categories != null ? categories : List.of());
    }

    public void setEntities(List<RecognizedEntity> entities) {
        this.entities = new ArrayList<>(entities != null ? entities : List.of());
    }

    public void setCachedChunks(List<String> chunks) {
        this.cachedChunks = new ArrayList<>(chunks != null ? chunks : List.of());
    }

    public void setBranchResults(Map<String, WorkflowResult> results) {
        this.branchResults = new LinkedHashMap<>(results);
    }

    public int incrementIterations() {
        return ++iterations;
    }

    public List<ReasoningStep> reasoningSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(reasoning));
    }

    public List<String> sourcesSnapshot() {
        return List.copyOf(sources);
    }

    void markStopped() {
        stopped = true;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, deepCopyValue(v)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), deepCopyValue(v)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> nested = new ArrayList<>();
            list.forEach(v -> nested.add(deepCopyValue(v)));
            return nested;
        }
        return value;
    }
}
