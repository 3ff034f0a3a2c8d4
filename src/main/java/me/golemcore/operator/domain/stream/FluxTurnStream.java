package me.golemcore.operator.domain.stream;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link TurnStream} backed by a Reactor {@link FluxSink}.
 */
@Slf4j
public final class FluxTurnStream implements TurnStream {

    private final FluxSink<StreamEvent> sink;
    private final AtomicBoolean terminated = new AtomicBoolean();
    private volatile boolean cancelled;

    public FluxTurnStream(FluxSink<StreamEvent> sink) {
        this.sink = sink;
        sink.onCancel(() -> cancelled = true);
    }

    /**
     * Creates a cold stream that runs {@code turn} on the given scheduler for
     * each subscriber. The turn body is not interrupted when the subscriber
     * cancels; it observes {@link #isCancelled()} instead.
     */
    public static Flux<StreamEvent> create(Scheduler scheduler, Consumer<TurnStream> turn) {
        return Flux.create(sink -> {
            FluxTurnStream stream = new FluxTurnStream(sink);
            scheduler.schedule(() -> {
                try {
                    turn.accept(stream);
                } catch (RuntimeException e) {
                    log.error("[Stream] Turn failed", e);
                    stream.fail("Internal error");
                } finally {
                    stream.close();
                }
            });
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    @Override
    public boolean isCancelled() {
        return cancelled || sink.isCancelled();
    }

    @Override
    public boolean emit(StreamEvent event) {
        if (event == null || terminated.get() || isCancelled()) {
            return false;
        }
        if (event.isTerminal()) {
            throw new IllegalArgumentException("Use complete() or fail() for terminal events");
        }
        sink.next(event);
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

    /**
     * Closes the stream without a terminal event if none was sent.
     */
    void close() {
        if (terminated.compareAndSet(false, true)) {
            sink.complete();
        }
    }

    private void terminate(StreamEvent event) {
        if (!terminated.compareAndSet(false, true)) {
            log.debug("[Stream] Ignoring {} after termination", event.type());
            return;
        }
        if (!isCancelled()) {
            sink.next(event);
        }
        sink.complete();
    }
}
