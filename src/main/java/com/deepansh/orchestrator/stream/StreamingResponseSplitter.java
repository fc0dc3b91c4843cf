package com.deepansh.orchestrator.stream;

/**
 * Demultiplexes an incrementally arriving model response into thinking and
 * output sections.
 *
 * Until the first section marker is seen, text is buffered and not forwarded.
 * After a marker, each increment is forwarded to the listener under the
 * current section type. A trailing fragment that could be the start of a
 * marker is held back until the next increment resolves it.
 *
 * If the stream ends without any marker, the buffered text is forwarded once
 * as {@link ContentType#OUTPUT}, so plain providers still report progress.
 *
 * Not thread-safe: one instance per model call.
 */
public class StreamingResponseSplitter {

    @FunctionalInterface
    public interface SectionListener {
        void onSection(ContentType type, String text);
    }

    private final SectionListener listener;
    private final StringBuilder full = new StringBuilder();
    private final StringBuilder pending = new StringBuilder();
    private ContentType mode;
    private boolean finished;

    public StreamingResponseSplitter(SectionListener listener) {
        this.listener = listener;
    }

    public void accept(String delta) {
        if (finished) {
            throw new IllegalStateException("Splitter already finished");
        }
        if (delta == null || delta.isEmpty()) return;
        full.append(delta);
        pending.append(delta);
        drain(false);
    }

    /** Flushes anything held back and returns the complete response text. */
    public String finish() {
        if (!finished) {
            drain(true);
            finished = true;
        }
        return full.toString();
    }

    public ContentType currentMode() {
        return mode;
    }

    private void drain(boolean atEnd) {
        while (true) {
            int thinkingAt = pending.indexOf(ResponseSections.THINKING_MARKER);
            int answerAt = pending.indexOf(ResponseSections.ANSWER_MARKER);
            if (thinkingAt < 0 && answerAt < 0) break;

            boolean thinkingFirst = answerAt < 0 || (thinkingAt >= 0 && thinkingAt < answerAt);
            int at = thinkingFirst ? thinkingAt : answerAt;
            int markerLength = thinkingFirst
                    ? ResponseSections.THINKING_MARKER.length()
                    : ResponseSections.ANSWER_MARKER.length();

            // text ahead of the very first marker is preamble and is not forwarded
            if (mode != null && at > 0) {
                emit(pending.substring(0, at));
            }
            pending.delete(0, at + markerLength);
            mode = thinkingFirst ? ContentType.THINKING : ContentType.OUTPUT;
        }

        if (mode == null) {
            if (atEnd && pending.length() > 0) {
                emit(ContentType.OUTPUT, pending.toString());
                pending.setLength(0);
            }
            return;
        }

        int holdBack = atEnd ? 0 : partialMarkerSuffix();
        int ready = pending.length() - holdBack;
        if (ready > 0) {
            emit(pending.substring(0, ready));
            pending.delete(0, ready);
        }
    }

    private int partialMarkerSuffix() {
        return Math.max(
                partialSuffix(ResponseSections.THINKING_MARKER),
                partialSuffix(ResponseSections.ANSWER_MARKER));
    }

    private int partialSuffix(String marker) {
        int max = Math.min(marker.length() - 1, pending.length());
        for (int k = max; k > 0; k--) {
            if (pending.substring(pending.length() - k).equals(marker.substring(0, k))) {
                return k;
            }
        }
        return 0;
    }

    private void emit(String text) {
        emit(mode, text);
    }

    private void emit(ContentType type, String text) {
        if (!text.isEmpty()) {
            listener.onSection(type, text);
        }
    }
}
