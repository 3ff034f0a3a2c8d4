package me.golemcore.operator.testsupport;

import me.golemcore.operator.domain.stream.StreamEvent;
import me.golemcore.operator.domain.stream.TurnStream;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link TurnStream} that records every event, including the
 * terminal one, and can be cancelled on demand.
 */
public final class RecordingTurnStream implements TurnStream {

    private final List<StreamEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;
    private volatile boolean terminated;

    public List<StreamEvent> events() {
        return events;
    }

    public List<StreamEvent> eventsOfType(String type) {
        return events.stream().filter(event -> type.equals(event.type())).toList();
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (StreamEvent event : eventsOfType(StreamEvent.TEXT)) {
            sb.append(event.data().get("chunk"));
        }
        return sb.toString();
    }

    public void cancel() {
        cancelled = true;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public boolean emit(StreamEvent event) {
        if (terminated || cancelled) {
            return false;
        }
        events.add(event);
        return true;
    }

    @Override
    public void complete(String conversationId) {
        terminate(StreamEvent.done(conversationId));
    }

    @Override
    public void fail(String message) {
        terminate(StreamEvent.error(message));
    }

    private void terminate(StreamEvent event) {
        if (terminated) {
            return;
        }
        terminated = true;
        if (!cancelled) {
            events.add(event);
        }
    }
}
