package com.deepansh.orchestrator.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams workflow progress to one client over Server-Sent Events.
 *
 * Callbacks only enqueue a frame into a bounded buffer and return. A single
 * drain task on the observer executor writes frames to the emitter in order.
 * When the buffer is full the frame is dropped and counted, so a slow or
 * stalled client can never hold up a branch or a filter lane. The terminal
 * frame is never dropped; it evicts the oldest queued frame instead.
 *
 * The final result (or error) frame is terminal: once written, the emitter
 * is completed and further frames are ignored. If the stream closes before
 * that (client gone, timeout, write error) the disconnect callback runs once.
 */
@Slf4j
public class SseWorkflowObserver implements WorkflowObserver {

    private static final int DEFAULT_CAPACITY = 1024;

    private final SseEmitter emitter;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final BlockingQueue<Frame> queue;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private volatile Runnable onDisconnect = () -> { };
    private final AtomicLong dropped = new AtomicLong();

    public SseWorkflowObserver(SseEmitter emitter, ObjectMapper objectMapper, Executor executor) {
        this(emitter, objectMapper, executor, DEFAULT_CAPACITY);
    }

    public SseWorkflowObserver(SseEmitter emitter, ObjectMapper objectMapper, Executor executor, int capacity) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.queue = new ArrayBlockingQueue<>(capacity);
        emitter.onCompletion(this::disconnected);
        emitter.onTimeout(() -> {
            log.warn("SSE stream timed out, dropping further events");
            disconnected();
        });
        emitter.onError(e -> disconnected());
    }

    /** Runs when the client goes away before the terminal frame was written. */
    public void onDisconnect(Runnable callback) {
        this.onDisconnect = callback;
    }

    @Override
    public void onStepStart(String step, Map<String, Object> data) {
        publish("step_start", payload("step", step, "data", data));
    }

    @Override
    public void onStepComplete(String step, Map<String, Object> data) {
        publish("step_complete", payload("step", step, "data", data));
    }

    @Override
    public void onStreamingContent(StreamingContent content) {
        publish("streaming", payload(
                "phase", content.phase(),
                "content_type", content.contentType().label(),
                "content", content.text(),
                "metadata", content.metadata()));
    }

    @Override
    public void onToolCallStart(String toolName, Map<String, Object> arguments, String category) {
        publish("tool_call_start", payload("tool", toolName, "arguments", arguments, "category", category));
    }

    @Override
    public void onToolCallComplete(String toolName, String result, long latencyMs, String category) {
        publish("tool_call_complete", payload(
                "tool", toolName, "result", result, "latency_ms", latencyMs, "category", category));
    }

    @Override
    public void onWorkflowEvent(String type, String message, Map<String, Object> metadata) {
        publish("workflow_event", payload("type", type, "message", message, "metadata", metadata));
    }

    @Override
    public void onFilterStart(int totalChunks, String query, String category) {
        publish("filter_start", payload("total", totalChunks, "query", query, "category", category));
    }

    @Override
    public void onFilterProgress(int lane, int chunkIndex, String chunk, boolean relevant,
                                 String thinking, String category, int score) {
        publish("filter_progress", payload(
                "lane", lane, "chunk_index", chunkIndex, "chunk", chunk, "relevant", relevant,
                "thinking", thinking, "category", category, "score", score));
    }

    @Override
    public void onFilterComplete(int totalChunks, int relevantCount, int filteredOutCount, String category) {
        publish("filter_complete", payload(
                "total", totalChunks, "relevant", relevantCount, "filtered_out", filteredOutCount,
                "category", category));
    }

    /** Sends the run result as the last frame and completes the stream. */
    public void complete(Object result) {
        enqueue(new Frame("result", result, true));
    }

    public void fail(String error) {
        enqueue(new Frame("error", payload("error", error), true));
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void publish(String name, Object data) {
        enqueue(new Frame(name, data, false));
    }

    private void enqueue(Frame frame) {
        if (closed.get()) return;
        while (!queue.offer(frame)) {
            // the terminal frame always gets in, at the cost of the oldest queued event
            Frame evicted = frame.terminal() ? queue.poll() : frame;
            if (evicted != null) {
                long total = dropped.incrementAndGet();
                if (total == 1 || total % 100 == 0) {
                    log.warn("SSE buffer full, dropped {} event(s) so far [last={}]", total, evicted.name());
                }
            }
            if (!frame.terminal()) return;
        }
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Observer executor rejected drain task; {} event(s) stay queued", queue.size());
        }
    }

    private void drain() {
        try {
            Frame frame;
            while ((frame = queue.poll()) != null) {
                if (closed.get()) {
                    queue.clear();
                    return;
                }
                send(frame);
            }
        } finally {
            draining.set(false);
        }
        // a frame may have arrived between the last poll and releasing the flag
        if (!queue.isEmpty() && !closed.get()) {
            scheduleDrain();
        }
    }

    private void send(Frame frame) {
        try {
            emitter.send(SseEmitter.event()
                    .name(frame.name())
                    .data(objectMapper.writeValueAsString(frame.data())));
            if (frame.terminal()) {
                finished.set(true);
                closed.set(true);
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.warn("SSE client gone, closing stream: {}", e.getMessage());
            queue.clear();
            disconnected();
        }
    }

    private void disconnected() {
        if (!closed.compareAndSet(false, true) || finished.get()) return;
        log.info("SSE client disconnected before the run finished");
        try {
            onDisconnect.run();
        } catch (RuntimeException e) {
            log.warn("Disconnect callback failed: {}", e.getMessage());
        }
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private record Frame(String name, Object data, boolean terminal) {
    }
}
