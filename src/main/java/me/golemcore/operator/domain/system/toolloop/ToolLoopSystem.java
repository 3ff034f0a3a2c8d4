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

import me.golemcore.operator.domain.stream.TurnStream;

/**
 * Drives the LLM through tool-call round trips until it produces a final
 * answer.
 */
public interface ToolLoopSystem {

    /**
     * Runs one turn. Progress and the final answer are emitted to
     * {@code stream}; the stream is not terminated here.
     *
     * @throws OracleUnavailableException
     *             if an LLM call fails
     */
    ToolLoopTurnResult processTurn(TurnContext context, TurnStream stream);
}
