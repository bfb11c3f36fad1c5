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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.EngineSettings;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.inbound.ChannelPort;
import me.golemcore.chorus.port.outbound.HistorySource;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a {@link PersonaEngine} from shared services and fresh per-persona
 * executors.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PersonaEngineFactory {

    // topic comparison, participation decision and reply
    static final int ORACLE_CALLS_PER_CYCLE = 3;

    private final BotProperties properties;
    private final ConversationStore conversationStore;
    private final OracleService oracleService;
    private final ParticipationDecider participationDecider;
    private final ReplyComposer replyComposer;
    private final ReplySender replySender;
    private final AttachmentFolder attachmentFolder;
    private final Clock clock;

    public PersonaEngine create(String personaId, RoleConfig role, ChannelPort channel) {
        HistorySource historySource = channel.supportsNativeHistory()
                ? new ChannelHistorySource(channel, conversationStore)
                : conversationStore;
        EngineSettings settings = settings();
        ExecutorService workers = Executors.newFixedThreadPool(settings.workerConcurrency(),
                namedThreads("persona-" + personaId + "-worker"));
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(
                namedThreads("persona-" + personaId + "-timer"));
        EngineServices services = new EngineServices(oracleService, participationDecider, replyComposer,
                replySender, attachmentFolder);
        return new PersonaEngine(personaId, role, channel, historySource, services, settings, clock, workers, timer);
    }

    EngineSettings settings() {
        BotProperties.EngineProperties engine = properties.getEngine();
        return new EngineSettings(
                engine.getQueueCapacity(),
                engine.getWorkerConcurrency(),
                Duration.ofMillis(engine.getQueueItemMaxAgeMs()),
                Duration.ofMillis(engine.getParticipationMaxAgeMs()),
                Duration.ofMillis(engine.getTopicCacheTtlMs()),
                engine.getTopicCacheMaxEntries(),
                observationGrace(),
                Duration.ofMillis(engine.getJanitorIntervalMs()),
                engine.getCapacityNotice());
    }

    /**
     * Grace before the janitor stops an observation. Never shorter than a cycle
     * may legitimately take while every call stays within its own timeout.
     */
    Duration observationGrace() {
        long configured = properties.getEngine().getObservationGraceMs();
        long cycleBudget = ORACLE_CALLS_PER_CYCLE * properties.getOracle().getTimeoutMs()
                + properties.getEngine().getSendTimeoutMs();
        if (configured < cycleBudget) {
            log.warn("[Janitor] observation grace {}ms is shorter than one cycle's timeouts, using {}ms",
                    configured, cycleBudget);
            return Duration.ofMillis(cycleBudget);
        }
        return Duration.ofMillis(configured);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
