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
import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.domain.model.QueueItem;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded FIFO admission queue in front of a persona's message processing.
 *
 * <p>
 * At most {@code maxConcurrent} messages are processed at once. When a worker
 * finishes it immediately pulls the next item, so the queue drains as a
 * pipeline rather than in batches. A full queue rejects new messages instead
 * of blocking the channel thread.
 */
@Slf4j
public class IntakeQueue {

    private final String personaName;
    private final int capacity;
    private final int maxConcurrent;
    private final Executor workerExecutor;
    private final Consumer<InboundMessage> processor;
    private final Clock clock;

    private final Object lock = new Object();
    private final Deque<QueueItem> queue = new ArrayDeque<>();
    private final AtomicLong droppedCount = new AtomicLong();
    private int processingCount = 0;

    public IntakeQueue(String personaName, int capacity, int maxConcurrent, Executor workerExecutor,
            Consumer<InboundMessage> processor, Clock clock) {
        if (capacity <= 0 || maxConcurrent <= 0) {
            throw new IllegalArgumentException("capacity and maxConcurrent must be positive");
        }
        this.personaName = personaName;
        this.capacity = capacity;
        this.maxConcurrent = maxConcurrent;
        this.workerExecutor = workerExecutor;
        this.processor = processor;
        this.clock = clock;
    }

    /**
     * @return {@code false} if the queue is full and the message was dropped
     */
    public boolean offer(InboundMessage message) {
        synchronized (lock) {
            if (queue.size() >= capacity) {
                long dropped = droppedCount.incrementAndGet();
                log.warn("[Intake] {} queue full ({}), dropping message {} from {} (dropped so far: {})",
                        personaName, capacity, message.getMessageId(), message.getConversationId(), dropped);
                return false;
            }
            queue.addLast(new QueueItem(message, clock.instant()));
        }
        drain();
        return true;
    }

    /**
     * Removes queued items that waited longer than {@code maxAge}.
     */
    public int evictStale(Instant now, Duration maxAge) {
        int evicted = 0;
        synchronized (lock) {
            Iterator<QueueItem> iterator = queue.iterator();
            while (iterator.hasNext()) {
                QueueItem item = iterator.next();
                if (item.waitedUntil(now).compareTo(maxAge) > 0) {
                    iterator.remove();
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.warn("[Intake] {} evicted {} stale queued messages", personaName, evicted);
        }
        return evicted;
    }

    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public int inFlight() {
        synchronized (lock) {
            return processingCount;
        }
    }

    public long droppedCount() {
        return droppedCount.get();
    }

    private void drain() {
        while (true) {
            QueueItem next;
            synchronized (lock) {
                if (processingCount >= maxConcurrent || queue.isEmpty()) {
                    return;
                }
                next = queue.pollFirst();
                processingCount++;
            }

            try {
                workerExecutor.execute(() -> process(next));
            } catch (RejectedExecutionException e) {
                synchronized (lock) {
                    processingCount--;
                }
                log.warn("[Intake] {} worker pool rejected message {}: {}", personaName,
                        next.message().getMessageId(), e.getMessage());
                return;
            }
        }
    }

    private void process(QueueItem item) {
        log.debug("[Intake] {} picked message {} after {}ms in queue", personaName, item.message().getMessageId(),
                item.waitedUntil(clock.instant()).toMillis());
        try {
            processor.accept(item.message());
        } catch (Exception e) { // NOSONAR - must not kill worker thread
            log.error("[Intake] {} failed to process message {}: {}", personaName, item.message().getMessageId(),
                    e.getMessage(), e);
        } finally {
            synchronized (lock) {
                processingCount--;
            }
            drain();
        }
    }
}
