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
import me.golemcore.chorus.domain.model.EngineSettings;
import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.domain.model.ParticipationStrategy;
import me.golemcore.chorus.domain.model.PersonaSnapshot;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.port.inbound.ChannelPort;
import me.golemcore.chorus.port.outbound.HistorySource;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One running persona: its channel connection, intake queue, observation
 * scheduler, topic gate and janitor, plus the executors they run on.
 *
 * <p>
 * Personas never share state except through the {@link HistorySource}.
 */
@Slf4j
public class PersonaEngine {

    private final String personaId;
    private final RoleConfig role;
    private final ChannelPort channel;
    private final HistorySource historySource;
    private final EngineServices services;
    private final EngineSettings settings;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;

    private final TopicChangeGate topicGate;
    private final ObservationScheduler scheduler;
    private final IntakeQueue intakeQueue;
    private final CleanupJanitor janitor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public PersonaEngine(String personaId, RoleConfig role, ChannelPort channel, HistorySource historySource,
            EngineServices services, EngineSettings settings, Clock clock, ExecutorService workers,
            ScheduledExecutorService timer) {
        this.personaId = personaId;
        this.role = role;
        this.channel = channel;
        this.historySource = historySource;
        this.services = services;
        this.settings = settings;
        this.workers = workers;
        this.timer = timer;

        this.topicGate = new TopicChangeGate(role.getName(), services.oracle(), clock,
                settings.participationMaxAge(), settings.topicCacheTtl(), settings.topicCacheMaxEntries());
        this.scheduler = new ObservationScheduler(role, historySource, topicGate, services, channel, timer, workers,
                clock);
        this.intakeQueue = new IntakeQueue(role.getName(), settings.queueCapacity(), settings.workerConcurrency(),
                workers, this::process, clock);
        this.janitor = new CleanupJanitor(role.getName(), topicGate, intakeQueue, scheduler, clock,
                settings.queueItemMaxAge(), settings.observationGrace());
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        channel.onMessage(this::accept);
        channel.start();
        janitor.start(timer, settings.janitorInterval());
        log.info("[Persona] {} ({}) started on {}: strategy={}, delay={}ms, history={}", personaId, role.getName(),
                channel.getChannelType(), role.getParticipationStrategy(), role.getObservationDelay().toMillis(),
                role.getMaxObservationMessages());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        janitor.stop();
        scheduler.shutdown();
        try {
            channel.stop();
        } catch (RuntimeException e) {
            log.warn("[Persona] {} channel did not stop cleanly: {}", personaId, e.getMessage());
        }
        shutdownExecutor(timer);
        shutdownExecutor(workers);
        log.info("[Persona] {} stopped", personaId);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Entry point for channel messages. Never blocks on processing.
     *
     * @return {@code true} if the message was admitted
     */
    public boolean accept(InboundMessage message) {
        if (message == null || message.isBot()) {
            return false;
        }
        if (!message.hasText() && !message.hasAttachments()) {
            return false;
        }
        if (intakeQueue.offer(message)) {
            return true;
        }
        sendCapacityNotice(message);
        return false;
    }

    void process(InboundMessage message) {
        String content = services.attachmentFolder().fold(message);
        if (content.isBlank()) {
            return;
        }

        if (role.getParticipationStrategy() == ParticipationStrategy.ALWAYS_USER_QUESTION) {
            answerDirectly(message, content);
        } else {
            observe(message, content);
        }
    }

    private void answerDirectly(InboundMessage message, String content) {
        if (message.isReply()) {
            log.debug("[Persona] {} ignores reply {}", personaId, message.getMessageId());
            return;
        }

        String conversationId = message.getConversationId();
        historySource.record(conversationId, message.getAuthor(), content, false, message.getMessageId(), false);
        channel.showTyping(conversationId);
        try {
            String rawAnswer = services.oracle().ask(services.composer().composeAnswerPrompt(role, content),
                    new OracleContext(role.getName(), "answer", conversationId));
            String answer = services.composer().finalizeReply(rawAnswer);
            historySource.record(conversationId, role.getName(), answer, true, null, false);
            services.sender().send(channel, conversationId, answer, message.getMessageId());
        } catch (OracleException e) {
            log.warn("[Persona] {} could not answer {} in {}: {}", personaId, message.getMessageId(),
                    conversationId, e.getMessage());
        }
    }

    private void observe(InboundMessage message, String content) {
        historySource.record(message.getConversationId(), message.getAuthor(), content, false,
                message.getMessageId(), message.isReply());
        scheduler.schedule(message);
    }

    private void sendCapacityNotice(InboundMessage message) {
        try {
            CompletableFuture<Void> sent = channel.sendMessage(message.getConversationId(),
                    settings.capacityNotice(), message.getMessageId());
            if (sent != null) {
                sent.exceptionally(e -> {
                    log.warn("[Persona] {} capacity notice failed: {}", personaId, e.getMessage());
                    return null;
                });
            }
        } catch (RuntimeException e) {
            log.warn("[Persona] {} capacity notice failed: {}", personaId, e.getMessage());
        }
    }

    public PersonaSnapshot snapshot() {
        return PersonaSnapshot.builder()
                .personaId(personaId)
                .name(role.getName())
                .strategy(role.getParticipationStrategy())
                .observationDelayMs(role.getObservationDelay().toMillis())
                .running(running.get())
                .queuedMessages(intakeQueue.size())
                .inFlightMessages(intakeQueue.inFlight())
                .droppedMessages(intakeQueue.droppedCount())
                .pendingObservations(scheduler.pendingCount())
                .participationRecords(topicGate.participationCount())
                .topicCacheEntries(topicGate.topicCacheSize())
                .build();
    }

    public String getPersonaId() {
        return personaId;
    }

    public RoleConfig getRole() {
        return role;
    }

    ObservationScheduler getScheduler() {
        return scheduler;
    }

    TopicChangeGate getTopicGate() {
        return topicGate;
    }

    CleanupJanitor getJanitor() {
        return janitor;
    }

    private void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
