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

/**
 * Ordered output channel of one turn.
 *
 * <p>
 * Events are delivered as they are emitted. A stream terminates exactly once,
 * with {@link #complete} or {@link #fail}; once the caller has gone away
 * ({@link #isCancelled()}) emits are dropped and termination closes silently.
 */
public interface TurnStream {

    /**
     * True once the caller disconnected. Checked by producers before each
     * oracle call and each emitted event.
     */
    boolean isCancelled();

    /**
     * Emits a non-terminal event.
     *
     * @return false if the event was dropped because the stream is cancelled or
     *         terminated
     */
    boolean emit(StreamEvent event);

    /**
     * Emits {@code done} and closes the stream.
     */
    void complete(String conversationId);

    /**
     * Emits {@code error} and closes the stream.
     */
    void fail(String message);

    /**
     * Emits text as consecutive chunks of at most {@code chunkSize} characters.
     *
     * @return false if the stream was cancelled before all chunks were emitted
     */
    default boolean emitText(String text, int chunkSize) {
        if (text == null || text.isEmpty()) {
            return !isCancelled();
        }
        int size = Math.max(1, chunkSize);
        for (int start = 0; start < text.length(); start += size) {
            String chunk = text.substring(start, Math.min(text.length(), start + size));
            if (!emit(StreamEvent.text(chunk))) {
                return false;
            }
        }
        return true;
    }
}
