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
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.domain.model.ParticipationRecord;
import me.golemcore.chorus.domain.model.TopicCacheEntry;
import me.golemcore.chorus.domain.model.YesNoAnswer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Keeps a persona from speaking twice about the same topic.
 *
 * <p>
 * After a persona has spoken in a conversation, a new observation only goes
 * ahead if the topic has moved on. The comparison is done by the oracle and
 * its verdict is cached by the hash of the current topic summary, so an
 * unchanged summary costs at most one oracle call per cache lifetime. Any
 * doubt (unclear answer, oracle failure) counts as "unchanged".
 */
@Slf4j
public class TopicChangeGate {

    private final String personaName;
    private final OracleService oracleService;
    private final Clock clock;
    private final Duration participationMaxAge;
    private final Duration topicCacheTtl;
    private final int topicCacheMaxEntries;

    private final Map<String, ParticipationRecord> participations = new ConcurrentHashMap<>();
    private final Map<String, TopicCacheEntry> topicCache = new ConcurrentHashMap<>();

    public TopicChangeGate(String personaName, OracleService oracleService, Clock clock,
            Duration participationMaxAge, Duration topicCacheTtl, int topicCacheMaxEntries) {
        this.personaName = personaName;
        this.oracleService = oracleService;
        this.clock = clock;
        this.participationMaxAge = participationMaxAge;
        this.topicCacheTtl = topicCacheTtl;
        this.topicCacheMaxEntries = topicCacheMaxEntries;
    }

    public boolean hasTopicChanged(String conversationId, String currentSummary) {
        ParticipationRecord last = participations.get(conversationId);
        if (last == null) {
            return true;
        }

        Instant now = clock.instant();
        if (isOlderThan(last.timestamp(), now, participationMaxAge)) {
            return true;
        }

        String hash = hash(currentSummary);
        TopicCacheEntry cached = topicCache.get(conversationId);
        if (cached != null && hash.equals(cached.hash()) && !isOlderThan(cached.timestamp(), now, topicCacheTtl)) {
            log.debug("[TopicGate] {} already compared this topic in {}", personaName, conversationId);
            return false;
        }

        try {
            String answer = oracleService.ask(comparisonPrompt(last.topicSummary(), currentSummary),
                    new OracleContext(personaName, "topic_change", conversationId));
            YesNoAnswer parsed = YesNoAnswer.parse(answer);
            if (!parsed.isDecisive()) {
                log.info("[TopicGate] {} got an unclear topic verdict in {}, treating as unchanged",
                        personaName, conversationId);
                return false;
            }
            topicCache.put(conversationId, new TopicCacheEntry(hash, now));
            return parsed == YesNoAnswer.YES;
        } catch (OracleException e) {
            log.warn("[TopicGate] {} topic comparison failed in {}: {}", personaName, conversationId,
                    e.getMessage());
            return false;
        }
    }

    public void recordParticipation(String conversationId, String topicSummary) {
        participations.put(conversationId, new ParticipationRecord(topicSummary, clock.instant()));
    }

    public Optional<ParticipationRecord> lastParticipation(String conversationId) {
        return Optional.ofNullable(participations.get(conversationId));
    }

    public int expireParticipations(Instant now) {
        return removeIf(participations, record -> isOlderThan(record.timestamp(), now, participationMaxAge));
    }

    public int expireTopicCache(Instant now) {
        return removeIf(topicCache, entry -> isOlderThan(entry.timestamp(), now, topicCacheTtl));
    }

    /**
     * Drops the oldest cache entries until the cache is within its ceiling.
     */
    public int trimTopicCache() {
        int excess = topicCache.size() - topicCacheMaxEntries;
        if (excess <= 0) {
            return 0;
        }
        List<Map.Entry<String, TopicCacheEntry>> entries = new ArrayList<>(topicCache.entrySet());
        entries.sort(Comparator.comparing(entry -> entry.getValue().timestamp()));
        int removed = 0;
        for (Map.Entry<String, TopicCacheEntry> entry : entries) {
            if (removed >= excess) {
                break;
            }
            if (topicCache.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int participationCount() {
        return participations.size();
    }

    public int topicCacheSize() {
        return topicCache.size();
    }

    static String comparisonPrompt(String previousTopic, String currentTopic) {
        return "Topic A (when you last spoke):\n" + previousTopic
                + "\n\nTopic B (now):\n" + currentTopic
                + "\n\nIs Topic B a different topic from Topic A? Answer YES if the topic has changed, "
                + "NO if it is essentially the same. Answer only YES or NO.";
    }

    static String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean isOlderThan(Instant timestamp, Instant now, Duration maxAge) {
        return Duration.between(timestamp, now).compareTo(maxAge) > 0;
    }

    private static <V> int removeIf(Map<String, V> map, Predicate<V> expired) {
        int removed = 0;
        for (Map.Entry<String, V> entry : map.entrySet()) {
            if (expired.test(entry.getValue()) && map.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
