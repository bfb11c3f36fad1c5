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
import me.golemcore.chorus.domain.model.JanitorReport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic cleanup of one persona's in-memory state: expired participation
 * records and topic-cache entries, the topic-cache ceiling, stale queued
 * messages and stuck observations. Sweeps never overlap.
 */
@Slf4j
public class CleanupJanitor {

    private final String personaName;
    private final TopicChangeGate topicGate;
    private final IntakeQueue intakeQueue;
    private final ObservationScheduler scheduler;
    private final Clock clock;
    private final Duration queueItemMaxAge;
    private final Duration observationGrace;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> handle;

    public CleanupJanitor(String personaName, TopicChangeGate topicGate, IntakeQueue intakeQueue,
            ObservationScheduler scheduler, Clock clock, Duration queueItemMaxAge, Duration observationGrace) {
        this.personaName = personaName;
        this.topicGate = topicGate;
        this.intakeQueue = intakeQueue;
        this.scheduler = scheduler;
        this.clock = clock;
        this.queueItemMaxAge = queueItemMaxAge;
        this.observationGrace = observationGrace;
    }

    public void start(ScheduledExecutorService timer, Duration interval) {
        long intervalMs = interval.toMillis();
        handle = timer.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        ScheduledFuture<?> current = handle;
        if (current != null) {
            current.cancel(false);
        }
    }

    public JanitorReport sweep() {
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("[Janitor] {} sweep already running, skipping", personaName);
            return JanitorReport.skippedRun();
        }
        try {
            Instant now = clock.instant();
            JanitorReport report = new JanitorReport(
                    topicGate.expireParticipations(now),
                    topicGate.expireTopicCache(now),
                    topicGate.trimTopicCache(),
                    intakeQueue.evictStale(now, queueItemMaxAge),
                    scheduler.reapStale(now, observationGrace),
                    false);
            if (report.total() > 0) {
                log.info("[Janitor] {} cleaned up: participations={}, topicCache={}+{}, queue={}, observations={}",
                        personaName, report.participationsExpired(), report.topicCacheExpired(),
                        report.topicCacheTrimmed(), report.queueItemsEvicted(), report.observationsReaped());
            }
            return report;
        } finally {
            sweeping.set(false);
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (Exception e) { // NOSONAR - must not kill scheduler thread
            log.error("[Janitor] {} sweep failed: {}", personaName, e.getMessage(), e);
        }
    }
}
