package com.deepansh.orchestrator.stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.deepansh.orchestrator.stream.ResponseSections.ANSWER_MARKER;
import static com.deepansh.orchestrator.stream.ResponseSections.THINKING_MARKER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamingResponseSplitterTest {

    private final List<String> events = new ArrayList<>();
    private StreamingResponseSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = new StreamingResponseSplitter((type, text) -> events.add(type + ":" + text));
    }

    @Test
    void accept_bothMarkersInOneDelta_routesSectionsAndDropsPreamble() {
        splitter.accept("pre" + THINKING_MARKER + "think" + ANSWER_MARKER + "ans");

        assertThat(events).containsExactly("THINKING:think", "OUTPUT:ans");
        assertThat(splitter.currentMode()).isEqualTo(ContentType.OUTPUT);
    }

    @Test
    void accept_markerSplitAcrossDeltas_isStillRecognised() {
        int half = ANSWER_MARKER.length() / 2;
        splitter.accept(ANSWER_MARKER.substring(0, half));
        splitter.accept(ANSWER_MARKER.substring(half));
        splitter.accept("hello");

        assertThat(events).containsExactly("OUTPUT:hello");
    }

    @Test
    void accept_trailingMarkerPrefix_isHeldBackUntilFinish() {
        splitter.accept(ANSWER_MARKER);
        splitter.accept("abc\n===");

        assertThat(events).containsExactly("OUTPUT:abc");

        splitter.finish();
        assertThat(events).containsExactly("OUTPUT:abc", "OUTPUT:\n===");
    }

    @Test
    void finish_noMarkerSeen_flushesBufferedTextOnceAsOutput() {
        splitter.accept("plain ");
        splitter.accept("text");

        assertThat(events).isEmpty();
        assertThat(splitter.finish()).isEqualTo("plain text");
        assertThat(events).containsExactly("OUTPUT:plain text");
    }

    @Test
    void finish_returnsFullTextIncludingMarkers() {
        String full = THINKING_MARKER + "a" + ANSWER_MARKER + "b";
        splitter.accept(full);

        assertThat(splitter.finish()).isEqualTo(full);
    }

    @Test
    void accept_afterFinish_throws() {
        splitter.finish();

        assertThatThrownBy(() -> splitter.accept("late"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void accept_emptyDelta_isIgnored() {
        splitter.accept("");
        splitter.accept(null);

        assertThat(splitter.finish()).isEmpty();
        assertThat(events).isEmpty();
    }
}
