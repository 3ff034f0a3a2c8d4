package me.golemcore.operator.domain.confirmation;

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

import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.EntityResolution;
import me.golemcore.operator.domain.model.OperatorTool;
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.PlatformActionResult;
import me.golemcore.operator.domain.resolution.EntityDirectory;
import me.golemcore.operator.domain.resolution.EntityResolver;
import me.golemcore.operator.domain.tool.WriteToolInput;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * State machine turning write tool calls into expiring pending actions that run
 * only after explicit confirmation.
 *
 * <pre>
 * stage ──► PENDING_CONFIRMATION ──confirm──► EXECUTED
 *                  │      └─────cancel──────► CANCELLED
 *                  └────────TTL elapsed─────► EXPIRED
 * </pre>
 *
 * <p>
 * Every transition goes through {@link PendingActionStore#transition}, so a
 * pending action executes at most once however many confirm calls race on it.
 * Expiry is checked inside the transition; the background sweep only prunes.
 * The handler runs after the action has left the active set: a failing handler
 * still consumes the action.
 */
@Service
@Slf4j
public class ConfirmationGateway {

    private static final int NOT_FOUND_SUGGESTIONS = 10;

    private final PendingActionStore store;
    private final EntityDirectory directory;
    private final EntityResolver resolver;
    private final WriteActionPolicy policy;
    private final PendingActionHandler handler;
    private final Duration ttl;
    private final Duration handlerTimeout;
    private final Clock clock;

    public ConfirmationGateway(PendingActionStore store, EntityDirectory directory, EntityResolver resolver,
            WriteActionPolicy policy, PendingActionHandler handler, OperatorProperties properties, Clock clock) {
        this.store = store;
        this.directory = directory;
        this.resolver = resolver;
        this.policy = policy;
        this.handler = handler;
        this.ttl = properties.getConfirmation().getTtl();
        this.handlerTimeout = properties.getTurn().getToolTimeout();
        this.clock = clock;
    }

    /**
     * Resolves the target of a write tool call and stages the action. Platform
     * failures while listing entities propagate to the caller.
     */
    public StagingOutcome stage(String userId, OperatorTool tool, WriteToolInput input) {
        if (!tool.isWrite()) {
            throw new IllegalArgumentException("Not a write tool: " + tool.getToolName());
        }
        EntityDomain domain = tool.getDomain();
        List<OwnedEntity> owned = directory.listOwned(userId, domain);
        EntityResolution resolution = resolver.resolve(owned, input.target());

        if (resolution.status() == EntityResolution.Status.AMBIGUOUS) {
            log.info("[Confirm] {} target {} is ambiguous: {} candidates", tool.getToolName(),
                    input.target().display(), resolution.candidates().size());
            return StagingOutcome.unresolved(true, resolution.candidates());
        }
        if (!resolution.isResolved()) {
            log.info("[Confirm] {} target {} not found among {} {} entities", tool.getToolName(),
                    input.target().display(), owned.size(), domain.getLabel());
            return StagingOutcome.unresolved(false, resolver.rank(owned, NOT_FOUND_SUGGESTIONS));
        }

        OwnedEntity target = resolution.entity();
        Instant now = clock.instant();
        PendingAction action = PendingAction.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .tool(tool)
                .target(target)
                .budgetChange(input.budgetChange())
                .reason(tool == OperatorTool.CANCEL_SUBSCRIPTION ? WriteActionPolicy.reasonOf(input) : null)
                .description(policy.describeAction(tool, target, input))
                .parameters(policy.parameters(tool, target, input))
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .state(PendingActionState.PENDING_CONFIRMATION)
                .build();
        store.save(action);
        log.info("[Confirm] Staged {} for user {}: {}", action.getId(), userId, action.getDescription());
        return StagingOutcome.staged(action);
    }

    /**
     * Confirms and executes a pending action.
     *
     * @throws ActionNotFoundException
     *             if the action is unknown, not pending, expired, or owned by
     *             another user
     */
    public ConfirmationOutcome confirm(String userId, String pendingId) {
        PendingAction executed = consume(userId, pendingId, PendingActionState.EXECUTED);
        log.info("[Confirm] Executing {}: {}", executed.getId(), executed.getDescription());

        try {
            CompletableFuture<PlatformActionResult> future = handler.execute(executed);
            PlatformActionResult result = future.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Confirm] Executed {}", executed.getId());
            return new ConfirmationOutcome(executed, result, null);
        } catch (TimeoutException e) {
            return failed(executed, "Timed out after " + handlerTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            return failed(executed, safeCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(executed, "Interrupted");
        } catch (RuntimeException e) {
            return failed(executed, safeCauseMessage(e));
        }
    }

    /**
     * Cancels a pending action without executing it.
     *
     * @throws ActionNotFoundException
     *             if the action is unknown, not pending, expired, or owned by
     *             another user
     */
    public PendingAction cancel(String userId, String pendingId) {
        PendingAction cancelled = consume(userId, pendingId, PendingActionState.CANCELLED);
        log.info("[Confirm] Cancelled {}: {}", cancelled.getId(), cancelled.getDescription());
        return cancelled;
    }

    /**
     * Returns the user's pending actions that can still be confirmed, oldest
     * first.
     */
    public List<PendingAction> pendingFor(String userId) {
        Instant now = clock.instant();
        return store.findAll().stream()
                .filter(action -> Objects.equals(action.getUserId(), userId))
                .filter(PendingAction::isPending)
                .filter(action -> !action.isExpiredAt(now))
                .toList();
    }

    /**
     * Confirms every outstanding action of the user. Actions resolved
     * concurrently by another caller are skipped.
     */
    public List<ConfirmationOutcome> confirmAll(String userId) {
        List<ConfirmationOutcome> outcomes = new ArrayList<>();
        for (PendingAction action : pendingFor(userId)) {
            try {
                outcomes.add(confirm(userId, action.getId()));
            } catch (ActionNotFoundException e) {
                log.debug("[Confirm] {} resolved concurrently, skipping", action.getId());
            }
        }
        return outcomes;
    }

    /**
     * Cancels every outstanding action of the user.
     */
    public List<PendingAction> cancelAll(String userId) {
        List<PendingAction> cancelled = new ArrayList<>();
        for (PendingAction action : pendingFor(userId)) {
            try {
                cancelled.add(cancel(userId, action.getId()));
            } catch (ActionNotFoundException e) {
                log.debug("[Confirm] {} resolved concurrently, skipping", action.getId());
            }
        }
        return cancelled;
    }

    /**
     * Moves expired actions to {@link PendingActionState#EXPIRED} and prunes
     * them.
     *
     * @return number of actions expired
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int expired = 0;
        for (PendingAction action : store.findAll()) {
            if (action.isPending() && action.isExpiredAt(now)) {
                if (store.transition(action.getId(), PendingActionState.PENDING_CONFIRMATION,
                        PendingActionState.EXPIRED, candidate -> candidate.isExpiredAt(now), now).isPresent()) {
                    expired++;
                }
                store.remove(action.getId());
            } else if (action.getState().isTerminal()) {
                store.remove(action.getId());
            }
        }
        if (expired > 0) {
            log.info("[Confirm] Expired {} pending action(s)", expired);
        }
        return expired;
    }

    private PendingAction consume(String userId, String pendingId, PendingActionState target) {
        Instant now = clock.instant();
        PendingAction transitioned = store.transition(pendingId, PendingActionState.PENDING_CONFIRMATION, target,
                action -> Objects.equals(action.getUserId(), userId) && !action.isExpiredAt(now), now)
                .orElse(null);
        if (transitioned == null) {
            expireIfStale(pendingId, now);
            log.info("[Confirm] {} of {} rejected: not found, resolved, expired or foreign", target, pendingId);
            throw new ActionNotFoundException(pendingId);
        }
        store.remove(pendingId);
        return transitioned;
    }

    private void expireIfStale(String pendingId, Instant now) {
        store.find(pendingId)
                .filter(action -> action.isPending() && action.isExpiredAt(now))
                .ifPresent(action -> {
                    store.transition(pendingId, PendingActionState.PENDING_CONFIRMATION,
                            PendingActionState.EXPIRED, candidate -> candidate.isExpiredAt(now), now);
                    store.remove(pendingId);
                });
    }

    private ConfirmationOutcome failed(PendingAction action, String error) {
        log.warn("[Confirm] Execution of {} failed: {}", action.getId(), error);
        PendingAction consumed = action.toBuilder().executionError(error).build();
        return new ConfirmationOutcome(consumed, null, error);
    }

    private static String safeCauseMessage(Throwable e) {
        Throwable current = e;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message != null && !message.isBlank() ? message : current.getClass().getSimpleName();
    }
}
