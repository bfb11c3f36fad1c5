package me.golemcore.chorus.domain.model;

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

import java.util.Arrays;
import java.util.Optional;

/**
 * How a persona decides to take part in a conversation.
 */
public enum ParticipationStrategy {

    /**
     * Answer every fresh user question immediately, never wait or observe.
     */
    ALWAYS_USER_QUESTION("always_user_question"),

    /**
     * Observe for a while, then let the oracle decide whether to speak.
     */
    ORACLE_DECIDES("ai_decide");

    private final String id;

    ParticipationStrategy(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolves a strategy from its configuration id or enum name, ignoring case.
     */
    public static Optional<ParticipationStrategy> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(strategy -> strategy.id.equalsIgnoreCase(normalized)
                        || strategy.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
