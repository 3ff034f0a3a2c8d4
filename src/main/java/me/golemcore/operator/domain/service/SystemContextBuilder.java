package me.golemcore.operator.domain.service;

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

import me.golemcore.operator.domain.confirmation.PendingAction;
import me.golemcore.operator.domain.model.MemoryFact;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Builds the system context sent with every LLM call of a turn: operator
 * role, confirmation rules, remembered facts and outstanding pending actions.
 */
@Component
public class SystemContextBuilder {

    private static final String DOUBLE_NEWLINE = "\n\n";

    private static final String ROLE = "You are the operator assistant for an advertising and subscription "
            + "business. You can list the user's Meta ad sets and campaigns, TikTok ad groups and active "
            + "subscriptions, render charts, and pause, enable, re-budget or cancel them.";

    private static final String RULES = """
            # Rules
            - Every pause, enable, budget or cancellation tool only stages a pending action. Tell the user what \
            will happen and ask them to confirm; call confirm_action only after they explicitly agree.
            - Pending actions expire after a few minutes. If confirm_action reports that an action was not \
            found, stage it again.
            - When a tool returns not_found with suggestions, present them as a numbered list and ask which one \
            the user meant. Never guess.
            - Be concise and data-focused. Use markdown tables for tabular data.""";

    private final Clock clock;

    public SystemContextBuilder(Clock clock) {
        this.clock = clock;
    }

    public String build(List<MemoryFact> memories, List<PendingAction> pendingActions) {
        StringBuilder sb = new StringBuilder();
        sb.append(ROLE).append(DOUBLE_NEWLINE);
        sb.append(RULES).append(DOUBLE_NEWLINE);

        if (memories != null && !memories.isEmpty()) {
            sb.append("Things you remember about this user:\n");
            for (MemoryFact fact : memories) {
                sb.append("- ").append(fact.getText()).append("\n");
            }
            sb.append("\n");
        }

        if (pendingActions != null && !pendingActions.isEmpty()) {
            Instant now = clock.instant();
            sb.append("# Pending Actions\n");
            sb.append("These actions await the user's confirmation:\n");
            for (PendingAction action : pendingActions) {
                long secondsLeft = Math.max(0, action.getExpiresAt().getEpochSecond() - now.getEpochSecond());
                sb.append("- ").append(action.getId()).append(": ").append(action.getDescription())
                        .append(" (expires in ").append(secondsLeft).append("s)\n");
            }
            sb.append("\n");
        }

        sb.append("Current time: ").append(clock.instant()).append("\n");
        return sb.toString();
    }
}
