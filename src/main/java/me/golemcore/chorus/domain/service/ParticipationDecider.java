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
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.domain.model.ParticipationDecision;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.domain.model.YesNoAnswer;
import org.springframework.stereotype.Service;

/**
 * Asks the oracle whether a persona should speak, using the persona's own
 * decision prompt. Only an explicit YES leads to participation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParticipationDecider {

    static final String SEPARATOR = "\n\n---\n\n";

    private final OracleService oracleService;

    public ParticipationDecision decide(RoleConfig role, String formattedHistory, String conversationId) {
        if (!role.hasDecisionPrompt()) {
            return ParticipationDecision.decline("no_decision_prompt");
        }

        String prompt = formattedHistory + SEPARATOR + role.getDecisionPrompt();
        String answer;
        try {
            answer = oracleService.ask(prompt, new OracleContext(role.getName(), "participation", conversationId));
        } catch (OracleException e) {
            log.warn("[Decision] {} could not decide for {}: {}", role.getName(), conversationId, e.getMessage());
            return ParticipationDecision.decline("oracle_error");
        }

        YesNoAnswer parsed = YesNoAnswer.parse(answer);
        switch (parsed) {
        case YES:
            return ParticipationDecision.accept();
        case NO:
            return ParticipationDecision.decline("oracle_no");
        default:
            log.info("[Decision] {} got an unclear answer for {}: '{}'", role.getName(), conversationId,
                    abbreviate(answer));
            return ParticipationDecision.decline("ambiguous_answer");
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
