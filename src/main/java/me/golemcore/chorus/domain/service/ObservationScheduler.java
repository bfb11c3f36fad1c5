package me.golemcore.chorus.domain.service;

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
import me.golemcore.chorus.domain.model.DeliveryResult;
import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.domain.model.ObservationOutcome;
import me.golemcore.chorus.domain.model.ObservationState;
import me.golemcore.chorus.domain.model.ObservationTask;
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.domain.model.ParticipationDecision;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.domain.model.StoredMessage;
import me.golemcore.chorus.port.inbound.ChannelPort;
import me.golemcore.chorus.port.outbound.HistorySource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Debounced, single-flight observation of conversations for one persona.
 *
 * <p>
 * The first relevant message in an idle conversation schedules a cycle after
 * the persona's observation delay. Messages arriving meanwhile only join the
 * history the cycle will read. A cycle runs on the persona's worker pool:
 * <ol>
 * <li>read the window anchored at the trigger message</li>
 * <li>skip if the topic has not changed since the persona last spoke</li>
 * <li>refresh history, ask the oracle whether to speak</li>
 * <li>optionally refresh once more, compose and send the reply</li>
 * </ol>
 * The task entry is removed when the cycle ends, whatever the outcome.
 */
@Slf4j
public class ObservationScheduler {

    private final RoleConfig role;
    private final HistorySource historySource;
    private final TopicChangeGate topicGate;
    private final EngineServices services;
    private final ChannelPort channel;
    private final ScheduledExecutorService timer;
    private final ExecutorService workers;
    private final Clock clock;

    private final Map<String, ObservationTask> tasks = new ConcurrentHashMap<>();

    public ObservationScheduler(RoleConfig role, HistorySource historySource, TopicChangeGate topicGate,
            EngineServices services, ChannelPort channel, ScheduledExecutorService timer, ExecutorService workers,
            Clock clock) {
        this.role = role;
        this.historySource = historySource;
        this.topicGate = topicGate;
        this.services = services;
        this.channel = channel;
        this.timer = timer;
        this.workers = workers;
        this.clock = clock;
    }

    /**
     * Starts observing the trigger's conversation unless an observation is
     * already pending there.
     *
     * @return {@code true} if a new observation was scheduled
     */
    public boolean schedule(InboundMessage trigger) {
        if (trigger.isBot()) {
            return false;
        }

        String conversationId = trigger.getConversationId();
        ObservationTask task = new ObservationTask(conversationId, trigger.getMessageId(), clock.instant(),
                role.getObservationDelay());
        ObservationTask existing = tasks.putIfAbsent(conversationId, task);
        if (existing != null) {
            log.debug("[Observer] {} already observing {}, message {} joins the pending cycle", role.getName(),
                    conversationId, trigger.getMessageId());
            return false;
        }

        try {
            ScheduledFuture<?> handle = timer.schedule(() -> dispatch(task), role.getObservationDelay().toMillis(),
                    TimeUnit.MILLISECONDS);
            task.attachPendingDelay(handle);
        } catch (RejectedExecutionException e) {
            finish(task);
            log.warn("[Observer] {} could not schedule observation of {}: {}", role.getName(), conversationId,
                    e.getMessage());
            return false;
        }

        log.info("[Observer] {} will look at {} in {}ms (trigger={})", role.getName(), conversationId,
                role.getObservationDelay().toMillis(), trigger.getMessageId());
        return true;
    }

    /**
     * Force-stops observations that outlived their delay plus {@code grace}.
     * Observations already sending their reply are left to finish.
     */
    public int reapStale(Instant now, Duration grace) {
        int reaped = 0;
        for (ObservationTask task : tasks.values()) {
            if (now.isAfter(task.staleAfter(grace))) {
                if (task.getState() == ObservationState.REPLYING) {
                    log.debug("[Observer] {} lets slow reply in {} finish", role.getName(),
                            task.getConversationId());
                    continue;
                }
                if (task.markStale()) {
                    reaped++;
                    log.warn("[Observer] {} stopped stuck observation of {} (started {})", role.getName(),
                            task.getConversationId(), task.getStartTime());
                }
                tasks.remove(task.getConversationId(), task);
            }
        }
        return reaped;
    }

    public void shutdown() {
        for (ObservationTask task : tasks.values()) {
            task.cancel();
        }
        tasks.clear();
    }

    public int pendingCount() {
        return tasks.size();
    }

    public Optional<ObservationTask> findTask(String conversationId) {
        return Optional.ofNullable(tasks.get(conversationId));
    }

    void dispatch(ObservationTask task) {
        try {
            Future<?> running = workers.submit(() -> runCycle(task));
            task.attachRunningCycle(running);
        } catch (RejectedExecutionException e) {
            finish(task);
            log.warn("[Observer] {} worker pool rejected observation of {}", role.getName(),
                    task.getConversationId());
        }
    }

    ObservationOutcome runCycle(ObservationTask task) {
        ObservationOutcome outcome;
        try {
            outcome = observe(task);
        } catch (OracleException e) {
            outcome = task.isStale() ? ObservationOutcome.STALE : ObservationOutcome.FAILED;
            log.warn("[Observer] {} oracle failed while observing {}: {}", role.getName(),
                    task.getConversationId(), e.getMessage());
        } catch (Exception e) { // NOSONAR - must not kill worker thread
            outcome = ObservationOutcome.FAILED;
            log.error("[Observer] {} observation of {} failed: {}", role.getName(), task.getConversationId(),
                    e.getMessage(), e);
        } finally {
            finish(task);
        }
        log.info("[Observer] {} finished observing {}: {}", role.getName(), task.getConversationId(), outcome);
        return outcome;
    }

    private ObservationOutcome observe(ObservationTask task) {
        String conversationId = task.getConversationId();
        if (!task.advance(ObservationState.SCHEDULED, ObservationState.GATING)) {
            return ObservationOutcome.STALE;
        }

        List<StoredMessage> history = fetchHistory(task);
        if (history.isEmpty()) {
            return ObservationOutcome.NO_HISTORY;
        }

        ReplyComposer composer = services.composer();
        String formatted = composer.formatHistory(history);
        String topicSummary = composer.topicSummary(history, formatted);
        if (!topicSummary.isBlank() && !topicGate.hasTopicChanged(conversationId, topicSummary)) {
            task.advance(ObservationState.GATING, ObservationState.DECLINED);
            log.debug("[Observer] {} skips {}: topic unchanged", role.getName(), conversationId);
            return ObservationOutcome.DECLINED_TOPIC_UNCHANGED;
        }

        formatted = refresh(task, formatted);
        if (!task.advance(ObservationState.GATING, ObservationState.DECIDING)) {
            return ObservationOutcome.STALE;
        }

        ParticipationDecision decision = services.decider().decide(role, formatted, conversationId);
        if (!decision.participate()) {
            task.advance(ObservationState.DECIDING, ObservationState.DECLINED);
            log.info("[Observer] {} stays silent in {} ({})", role.getName(), conversationId, decision.reason());
            return ObservationOutcome.DECLINED_BY_ORACLE;
        }

        if (role.isRefreshBeforeReply()) {
            formatted = refresh(task, formatted);
        }

        String rawReply = services.oracle().ask(composer.composeReplyPrompt(role, formatted),
                new OracleContext(role.getName(), "reply", conversationId));
        String reply = composer.finalizeReply(rawReply);

        if (!task.advance(ObservationState.DECIDING, ObservationState.REPLYING)) {
            return ObservationOutcome.STALE;
        }

        DeliveryResult delivery = services.sender().send(channel, conversationId,
                composer.withPersonaHeader(role, reply), null);
        if (!delivery.delivered()) {
            return ObservationOutcome.FAILED;
        }

        historySource.record(conversationId, role.getName(), reply, true, null, false);

        topicGate.recordParticipation(conversationId, topicSummary);
        return ObservationOutcome.REPLIED;
    }

    private String refresh(ObservationTask task, String current) {
        List<StoredMessage> fresh = fetchHistory(task);
        return fresh.isEmpty() ? current : services.composer().formatHistory(fresh);
    }

    private List<StoredMessage> fetchHistory(ObservationTask task) {
        try {
            List<StoredMessage> history = historySource.getHistory(task.getConversationId(),
                    role.getMaxObservationMessages(), task.getTriggerMessageId());
            return history != null ? history : List.of();
        } catch (RuntimeException e) {
            log.warn("[Observer] {} could not read history of {}: {}", role.getName(), task.getConversationId(),
                    e.getMessage());
            return List.of();
        }
    }

    private void finish(ObservationTask task) {
        tasks.remove(task.getConversationId(), task);
        task.complete();
    }
}
