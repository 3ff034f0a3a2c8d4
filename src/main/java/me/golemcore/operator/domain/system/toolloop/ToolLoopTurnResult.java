package me.golemcore.operator.domain.system.toolloop;

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
 * Outcome of a tool loop turn.
 */
public record ToolLoopTurnResult(TurnContext context, Outcome outcome, String finalText, int llmCalls,
        int toolExecutions) {

    public enum Outcome {
        /** The LLM produced a final answer. */
        COMPLETED,
        /** The turn ran out of LLM calls or time; a step limit notice was streamed. */
        STEP_LIMIT,
        /** The caller disconnected. Nothing of the turn is to be persisted. */
        ABORTED
    }

    public boolean isFinished() {
        return outcome != Outcome.ABORTED;
    }
}
