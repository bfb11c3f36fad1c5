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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lets the oracle pick the observation delay of personas configured with a
 * zero delay, once, and remembers the choice across restarts.
 *
 * <p>
 * Choices are stored as {@code personaId -> milliseconds} in
 * {@code personas/observation-delays.json}. The oracle must answer with a whole
 * number of seconds between {@value #MIN_SECONDS} and {@value #MAX_SECONDS};
 * anything else, or a failed call, yields {@link #DEFAULT_DELAY}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ObservationDelayAdvisor {

    static final String DIRECTORY = "personas";
    static final String FILE = "observation-delays.json";
    static final int MIN_SECONDS = 2;
    static final int MAX_SECONDS = 15;
    static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

    private static final Pattern FIRST_INTEGER = Pattern.compile("-?\\d+");
    private static final TypeReference<LinkedHashMap<String, Long>> CACHE_TYPE = new TypeReference<>() {
    };

    private final OracleService oracleService;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    private final Object lock = new Object();

    public RoleConfig ensureObservationDelay(String personaId, RoleConfig role) {
        if (!role.isOracleDecides() || !role.getObservationDelay().isZero()
                || !properties.getEngine().isOracleChosenDelay()) {
            return role;
        }

        synchronized (lock) {
            Map<String, Long> cache = load();
            Long cachedMs = cache.get(personaId);
            if (cachedMs != null && cachedMs > 0) {
                log.info("[Delay] {} reuses observation delay {}ms", personaId, cachedMs);
                return withDelay(role, Duration.ofMillis(cachedMs));
            }

            Duration chosen = askOracle(role);
            cache.put(personaId, chosen.toMillis());
            save(cache);
            log.info("[Delay] {} observation delay set to {}s", personaId, chosen.toSeconds());
            return withDelay(role, chosen);
        }
    }

    Duration askOracle(RoleConfig role) {
        String prompt = "You are " + role.getName() + ", " + role.getDescription() + ". "
                + "In a group chat you watch the discussion for a while before deciding whether to speak. "
                + "How many seconds should you wait after a new question before looking at the discussion? "
                + "Answer with a single whole number between " + MIN_SECONDS + " and " + MAX_SECONDS + ".";
        try {
            String answer = oracleService.ask(prompt, OracleContext.of(role.getName(), "observation_delay"));
            return parseSeconds(answer);
        } catch (OracleException e) {
            log.warn("[Delay] oracle unavailable for {}, using {}s: {}", role.getName(),
                    DEFAULT_DELAY.toSeconds(), e.getMessage());
            return DEFAULT_DELAY;
        }
    }

    static Duration parseSeconds(String answer) {
        if (answer == null) {
            return DEFAULT_DELAY;
        }
        Matcher matcher = FIRST_INTEGER.matcher(answer.trim());
        if (!matcher.find()) {
            return DEFAULT_DELAY;
        }
        try {
            long seconds = Long.parseLong(matcher.group());
            if (seconds < MIN_SECONDS || seconds > MAX_SECONDS) {
                return DEFAULT_DELAY;
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return DEFAULT_DELAY;
        }
    }

    private Map<String, Long> load() {
        try {
            String json = storagePort.getText(DIRECTORY, FILE).join();
            if (json == null || json.isBlank()) {
                return new LinkedHashMap<>();
            }
            return objectMapper.readValue(json, CACHE_TYPE);
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Delay] could not read {}/{}: {}", DIRECTORY, FILE, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void save(Map<String, Long> cache) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(cache);
            storagePort.putTextAtomic(DIRECTORY, FILE, json, false).join();
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Delay] could not persist {}/{}: {}", DIRECTORY, FILE, e.getMessage());
        }
    }

    private static RoleConfig withDelay(RoleConfig role, Duration delay) {
        return role.toBuilder().observationDelay(delay).build();
    }
}
