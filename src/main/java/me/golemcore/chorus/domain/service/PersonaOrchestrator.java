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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.ChannelSpec;
import me.golemcore.chorus.domain.model.PersonaStatus;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.domain.model.RoleOverrides;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.inbound.ChannelFactory;
import me.golemcore.chorus.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts every configured persona, keeps track of how each one came up and
 * stops them all on shutdown. A persona that fails to start is reported in its
 * status and does not affect the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PersonaOrchestrator {

    private final BotProperties properties;
    private final RoleRegistry roleRegistry;
    private final ObservationDelayAdvisor delayAdvisor;
    private final PersonaEngineFactory engineFactory;
    private final List<ChannelFactory> channelFactories;
    private final Clock clock;

    private final Map<String, PersonaEngine> engines = new ConcurrentHashMap<>();
    private final Map<String, PersonaStatus> statuses = new ConcurrentHashMap<>();

    public void startAll() {
        List<BotProperties.PersonaProperties> personas = properties.getPersonas();
        if (personas.isEmpty()) {
            log.warn("[Orchestrator] no personas configured (bot.personas[*])");
            return;
        }
        for (BotProperties.PersonaProperties persona : personas) {
            start(persona);
        }
        long connected = statuses.values().stream().filter(PersonaStatus::isConnected).count();
        log.info("[Orchestrator] {}/{} personas running", connected, personas.size());
    }

    void start(BotProperties.PersonaProperties persona) {
        String personaId = persona.getId();
        if (personaId == null || personaId.isBlank()) {
            log.warn("[Orchestrator] skipping persona without id");
            return;
        }
        if (!persona.isEnabled()) {
            statuses.put(personaId, status(personaId, personaId, persona.getChannel(), false, "disabled"));
            return;
        }
        if (engines.containsKey(personaId)) {
            log.warn("[Orchestrator] persona {} configured twice, ignoring the duplicate", personaId);
            return;
        }

        PersonaEngine engine = null;
        try {
            RoleOverrides overrides = persona.toOverrides();
            if (persona.getStrategy() != null && overrides.getParticipationStrategy() == null) {
                log.warn("[Orchestrator] persona {} has unknown strategy '{}', ignoring it", personaId,
                        persona.getStrategy());
            }
            RoleConfig role = roleRegistry.resolve(personaId, overrides);
            role = delayAdvisor.ensureObservationDelay(personaId, role);

            if (persona.getToken() == null || persona.getToken().isBlank()) {
                throw new IllegalStateException("no token configured");
            }
            ChannelFactory factory = findFactory(persona.getChannel())
                    .orElseThrow(() -> new IllegalStateException("unsupported channel " + persona.getChannel()));
            ChannelPort channel = factory.create(new ChannelSpec(personaId, persona.getChannel(), persona.getToken()));

            engine = engineFactory.create(personaId, role, channel);
            engine.start();
            engines.put(personaId, engine);
            statuses.put(personaId, status(personaId, role.getName(), persona.getChannel(), true, null));
        } catch (RuntimeException e) {
            log.error("[Orchestrator] persona {} failed to start: {}", personaId, e.getMessage(), e);
            statuses.put(personaId, status(personaId, personaId, persona.getChannel(), false, e.getMessage()));
            if (engine != null) {
                releaseQuietly(engine);
            }
        }
    }

    @PreDestroy
    public void stopAll() {
        for (PersonaEngine engine : engines.values()) {
            try {
                engine.stop();
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] persona {} did not stop cleanly: {}", engine.getPersonaId(),
                        e.getMessage());
            }
            PersonaStatus previous = statuses.get(engine.getPersonaId());
            statuses.put(engine.getPersonaId(), status(engine.getPersonaId(), engine.getRole().getName(),
                    previous != null ? previous.getChannelType() : null, false, null));
        }
        engines.clear();
    }

    private void releaseQuietly(PersonaEngine engine) {
        try {
            engine.stop();
        } catch (RuntimeException e) {
            log.debug("[Orchestrator] cleanup of {} failed: {}", engine.getPersonaId(), e.getMessage());
        }
    }

    public List<PersonaStatus> getStatuses() {
        List<PersonaStatus> result = new ArrayList<>(statuses.values());
        result.sort(Comparator.comparing(PersonaStatus::getPersonaId));
        return result;
    }

    public Optional<PersonaEngine> findEngine(String personaId) {
        return Optional.ofNullable(engines.get(personaId));
    }

    private Optional<ChannelFactory> findFactory(String channelType) {
        return channelFactories.stream()
                .filter(factory -> factory.getChannelType().equalsIgnoreCase(channelType))
                .findFirst();
    }

    private PersonaStatus status(String personaId, String name, String channelType, boolean connected,
            String error) {
        return PersonaStatus.builder()
                .personaId(personaId)
                .name(name)
                .channelType(channelType)
                .connected(connected)
                .error(error)
                .updatedAt(clock.instant())
                .build();
    }
}
