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
 * Partial role definition. {@code null} fields leave the underlying value
 * untouched when merged.
 */
@Value
@Builder
public class RoleOverrides {

    private static final RoleOverrides NONE = RoleOverrides.builder().build();

    String name;
    String description;
    ParticipationStrategy participationStrategy;
    Duration observationDelay;
    String decisionPrompt;
    Integer maxObservationMessages;
    Boolean refreshBeforeReply;

    public static RoleOverrides none() {
        return NONE;
    }

    public boolean isEmpty() {
        return name == null && description == null && participationStrategy == null
                && observationDelay == null && decisionPrompt == null
                && maxObservationMessages == null && refreshBeforeReply == null;
    }

    /**
     * Applies non-null fields of this override on top of {@code base}.
     */
    public RoleConfig applyTo(RoleConfig base) {
        RoleConfig.RoleConfigBuilder builder = base.toBuilder();
        if (name != null) {
            builder.name(name);
        }
        if (description != null) {
            builder.description(description);
        }
        if (participationStrategy != null) {
            builder.participationStrategy(participationStrategy);
        }
        if (observationDelay != null) {
            builder.observationDelay(observationDelay);
        }
        if (decisionPrompt != null) {
            builder.decisionPrompt(decisionPrompt);
        }
        if (maxObservationMessages != null) {
            builder.maxObservationMessages(maxObservationMessages);
        }
        if (refreshBeforeReply != null) {
            builder.refreshBeforeReply(refreshBeforeReply);
        }
        return builder.build();
    }
}
