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
import me.golemcore.chorus.domain.model.ParticipationStrategy;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.domain.model.RoleOverrides;
import me.golemcore.chorus.port.outbound.EnvironmentPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the effective {@link RoleConfig} of a persona.
 *
 * <p>
 * Merge order, lowest priority first:
 * <ol>
 * <li>built-in defaults for the persona id (or a generic observer)</li>
 * <li>caller overrides, usually from application.properties</li>
 * <li>environment variables {@code BOT_ROLE_<ID>_<FIELD>}</li>
 * </ol>
 *
 * <p>
 * Environment values are validated one by one and invalid ones are dropped.
 * If the merged result is still unusable the whole merge is discarded and the
 * built-in base is returned. Resolution never throws.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleRegistry {

    static final String ENV_PREFIX = "BOT_ROLE_";

    static final Duration FALLBACK_OBSERVATION_DELAY = Duration.ofSeconds(5);

    static final String GENERIC_DECISION_PROMPT = "Observe the conversation above. Would a reply from you add "
            + "something useful right now that nobody has said yet? Answer only YES or NO.";

    private static final Map<String, RoleConfig> BUILT_IN_ROLES = buildDefaults();

    private final EnvironmentPort environment;

    public RoleConfig resolve(String personaId) {
        return resolve(personaId, RoleOverrides.none());
    }

    public RoleConfig resolve(String personaId, RoleOverrides overrides) {
        RoleConfig base = defaultRole(personaId);
        RoleConfig merged = base;

        if (overrides != null && !overrides.isEmpty()) {
            merged = overrides.applyTo(merged);
        }

        RoleOverrides fromEnvironment = readEnvironmentOverrides(personaId);
        if (!fromEnvironment.isEmpty()) {
            log.info("[Roles] applying environment overrides for persona {}", personaId);
            merged = fromEnvironment.applyTo(merged);
        }

        Optional<String> problem = validate(merged);
        if (problem.isPresent()) {
            log.error("[Roles] invalid configuration for persona {} ({}), using built-in defaults",
                    personaId, problem.get());
            return base;
        }
        return merged;
    }

    public Set<String> builtInPersonaIds() {
        return BUILT_IN_ROLES.keySet();
    }

    RoleConfig defaultRole(String personaId) {
        String key = personaId != null ? personaId.toLowerCase(Locale.ROOT) : "";
        RoleConfig builtIn = BUILT_IN_ROLES.get(key);
        if (builtIn != null) {
            return builtIn;
        }
        log.debug("[Roles] no built-in role for {}, using generic observer", personaId);
        return RoleConfig.builder()
                .name(personaId)
                .description("a participant in the conversation")
                .participationStrategy(ParticipationStrategy.ORACLE_DECIDES)
                .observationDelay(FALLBACK_OBSERVATION_DELAY)
                .decisionPrompt(GENERIC_DECISION_PROMPT)
                .maxObservationMessages(RoleConfig.DEFAULT_MAX_OBSERVATION_MESSAGES)
                .build();
    }

    RoleOverrides readEnvironmentOverrides(String personaId) {
        if (personaId == null || personaId.isBlank()) {
            return RoleOverrides.none();
        }
        String prefix = ENV_PREFIX + personaId.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_") + "_";
        RoleOverrides.RoleOverridesBuilder builder = RoleOverrides.builder();

        readText(prefix + "NAME").ifPresent(builder::name);
        readText(prefix + "DESCRIPTION").ifPresent(builder::description);
        readText(prefix + "PROMPT").ifPresent(builder::decisionPrompt);

        readText(prefix + "STRATEGY").ifPresent(value -> {
            Optional<ParticipationStrategy> strategy = ParticipationStrategy.fromId(value);
            if (strategy.isPresent()) {
                builder.participationStrategy(strategy.get());
            } else {
                log.warn("[Roles] ignoring {}STRATEGY={}: unknown strategy", prefix, value);
            }
        });

        readText(prefix + "DELAY").ifPresent(value -> {
            Long delayMs = parseLong(value);
            if (delayMs != null && delayMs >= 0) {
                builder.observationDelay(Duration.ofMillis(delayMs));
            } else {
                log.warn("[Roles] ignoring {}DELAY={}: expected a non-negative number of milliseconds",
                        prefix, value);
            }
        });

        readText(prefix + "MAX_MESSAGES").ifPresent(value -> {
            Long maxMessages = parseLong(value);
            if (maxMessages != null && maxMessages > 0 && maxMessages <= Integer.MAX_VALUE) {
                builder.maxObservationMessages(maxMessages.intValue());
            } else {
                log.warn("[Roles] ignoring {}MAX_MESSAGES={}: expected a positive integer", prefix, value);
            }
        });

        readText(prefix + "REFRESH_BEFORE_REPLY").ifPresent(value -> {
            if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
                builder.refreshBeforeReply(Boolean.parseBoolean(value));
            } else {
                log.warn("[Roles] ignoring {}REFRESH_BEFORE_REPLY={}: expected true or false", prefix, value);
            }
        });

        return builder.build();
    }

    static Optional<String> validate(RoleConfig role) {
        if (role.getName() == null || role.getName().isBlank()) {
            return Optional.of("missing name");
        }
        if (role.getDescription() == null || role.getDescription().isBlank()) {
            return Optional.of("missing description");
        }
        if (role.getParticipationStrategy() == null) {
            return Optional.of("missing participation strategy");
        }
        if (role.getObservationDelay() == null || role.getObservationDelay().isNegative()) {
            return Optional.of("negative observation delay");
        }
        if (role.getMaxObservationMessages() <= 0) {
            return Optional.of("non-positive history depth");
        }
        if (role.isOracleDecides() && !role.hasDecisionPrompt()) {
            return Optional.of("oracle-decided persona without a decision prompt");
        }
        return Optional.empty();
    }

    private Optional<String> readText(String key) {
        return environment.get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private static Long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Map<String, RoleConfig> buildDefaults() {
        Map<String, RoleConfig> roles = new LinkedHashMap<>();

        roles.put("expert", RoleConfig.builder()
                .name("Expert")
                .description("a domain expert who answers questions directly, accurately and concisely")
                .participationStrategy(ParticipationStrategy.ALWAYS_USER_QUESTION)
                .observationDelay(Duration.ZERO)
                .maxObservationMessages(10)
                .build());

        // Delay 0 lets the oracle pick an observation delay at startup
        roles.put("critic", RoleConfig.builder()
                .name("Critic")
                .description("a constructive critic who points out weak arguments, hidden risks and "
                        + "missing evidence")
                .participationStrategy(ParticipationStrategy.ORACLE_DECIDES)
                .observationDelay(Duration.ZERO)
                .decisionPrompt("Read the conversation above as a constructive critic. Is there a claim, "
                        + "plan or answer with a real flaw, risk or gap that nobody has pointed out yet? "
                        + "Answer only YES or NO.")
                .maxObservationMessages(10)
                .refreshBeforeReply(false)
                .build());

        roles.put("thinker", RoleConfig.builder()
                .name("Thinker")
                .description("a reflective thinker who connects ideas and offers a broader perspective")
                .participationStrategy(ParticipationStrategy.ORACLE_DECIDES)
                .observationDelay(Duration.ZERO)
                .decisionPrompt("Read the conversation above as a reflective thinker. Would a deeper or "
                        + "broader perspective genuinely move this discussion forward right now? "
                        + "Answer only YES or NO.")
                .maxObservationMessages(15)
                .refreshBeforeReply(true)
                .build());

        return Collections.unmodifiableMap(roles);
    }
}
