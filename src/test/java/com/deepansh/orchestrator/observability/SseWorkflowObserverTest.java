package com.deepansh.orchestrator.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SseWorkflowObserverTest {

    @Mock SseEmitter emitter;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void complete_sendsQueuedFramesThenCompletes() throws Exception {
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, Runnable::run);

        observer.onStepStart("intent_recognition", Map.of("run_id", "r"));
        observer.onWorkflowEvent("plan_generation_complete", "Plan generated", Map.of());
        observer.complete(Map.of("response", "done"));
        observer.onStepStart("late", Map.of());

        verify(emitter, times(3)).send(any(SseEmitter.SseEventBuilder.class));
        verify(emitter).complete();
    }

    @Test
    void fullBuffer_dropsEventsInsteadOfBlocking() throws Exception {
        List<Runnable> pending = new ArrayList<>();
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, pending::add, 2);

        observer.onStepStart("a", Map.of());
        observer.onStepStart("b", Map.of());
        observer.onStepStart("c", Map.of());

        assertThat(observer.droppedCount()).isEqualTo(1);
        assertThat(pending).hasSize(1);
        verify(emitter, never()).send(any(SseEmitter.SseEventBuilder.class));

        pending.get(0).run();
        verify(emitter, times(2)).send(any(SseEmitter.SseEventBuilder.class));
    }

    @Test
    void fullBuffer_terminalFrameEvictsOldestEvent() throws Exception {
        List<Runnable> pending = new ArrayList<>();
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, pending::add, 2);

        observer.onStepStart("a", Map.of());
        observer.onStepStart("b", Map.of());
        observer.complete(Map.of("response", "done"));

        assertThat(observer.droppedCount()).isEqualTo(1);
        pending.get(0).run();
        verify(emitter, times(2)).send(any(SseEmitter.SseEventBuilder.class));
        verify(emitter).complete();
    }

    @Test
    void clientGone_stopsSending() throws Exception {
        doThrow(new IOException("broken pipe")).when(emitter).send(any(SseEmitter.SseEventBuilder.class));
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, Runnable::run);

        observer.onStepStart("first", Map.of());
        observer.onStepStart("second", Map.of());

        verify(emitter, times(1)).send(any(SseEmitter.SseEventBuilder.class));
    }

    @Test
    void clientClosesStream_runsDisconnectCallbackOnce() {
        ArgumentCaptor<Runnable> completion = ArgumentCaptor.forClass(Runnable.class);
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, Runnable::run);
        verify(emitter).onCompletion(completion.capture());
        AtomicInteger disconnects = new AtomicInteger();
        observer.onDisconnect(disconnects::incrementAndGet);

        completion.getValue().run();
        completion.getValue().run();

        assertThat(disconnects).hasValue(1);
    }

    @Test
    void writeFailure_runsDisconnectCallback() throws Exception {
        doThrow(new IOException("broken pipe")).when(emitter).send(any(SseEmitter.SseEventBuilder.class));
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, Runnable::run);
        AtomicInteger disconnects = new AtomicInteger();
        observer.onDisconnect(disconnects::incrementAndGet);

        observer.onStepStart("first", Map.of());

        assertThat(disconnects).hasValue(1);
    }

    @Test
    void completionAfterResultFrame_isNotADisconnect() {
        ArgumentCaptor<Runnable> completion = ArgumentCaptor.forClass(Runnable.class);
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, Runnable::run);
        verify(emitter).onCompletion(completion.capture());
        AtomicInteger disconnects = new AtomicInteger();
        observer.onDisconnect(disconnects::incrementAndGet);

        observer.complete(Map.of("response", "done"));
        completion.getValue().run();

        assertThat(disconnects).hasValue(0);
    }
}
