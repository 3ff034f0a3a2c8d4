package me.golemcore.operator.domain.model;

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
 * Classifies why a tool call did not succeed.
 */
public enum ToolFailureKind {

    /**
     * The LLM asked for a tool that is not in the catalogue.
     */
    UNKNOWN_TOOL,

    /**
     * Tool input was missing or malformed. Nothing was staged or executed.
     */
    VALIDATION_FAILED,

    /**
     * confirm_action or cancel_action referenced an unknown, already resolved or
     * expired pending action.
     */
    ACTION_NOT_FOUND,

    /**
     * Tool execution failed during runtime (platform error, timeout, etc.).
     */
    EXECUTION_FAILED
}
