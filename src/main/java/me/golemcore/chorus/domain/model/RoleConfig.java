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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Resolved, immutable persona definition.
 *
 * <p>
 * A {@code decisionPrompt} is mandatory when the strategy is
 * {@link ParticipationStrategy#ORACLE_DECIDES}. An observation delay of zero
 * means the observation cycle starts immediately.
 */
@Value
@Builder(toBuilder = true)
public class RoleConfig {

    public static final int DEFAULT_MAX_OBSERVATION_MESSAGES = 10;

    String name;
    String description;
    ParticipationStrategy participationStrategy;

    @Builder.Default
    Duration observationDelay = Duration.ZERO;

    String decisionPrompt;

    @Builder.Default
    int maxObservationMessages = DEFAULT_MAX_OBSERVATION_MESSAGES;

    boolean refreshBeforeReply;

    public boolean isOracleDecides() {
        return participationStrategy == ParticipationStrategy.ORACLE_DECIDES;
    }

    public boolean hasDecisionPrompt() {
        return decisionPrompt != null && !decisionPrompt.isBlank();
    }
}
