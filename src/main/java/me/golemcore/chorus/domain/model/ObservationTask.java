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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pending or running observation for a single conversation.
 *
 * <p>
 * Holds the handle of the delay timer and of the running cycle so the janitor
 * can stop both. State changes are compare-and-set, so a task that was marked
 * {@link ObservationState#STALE} can never move on to
 * {@link ObservationState#REPLYING}.
 */
public final class ObservationTask {

    private final String conversationId;
    private final String triggerMessageId;
    private final Instant startTime;
    private final Duration delay;
    private final AtomicReference<ObservationState> state = new AtomicReference<>(ObservationState.SCHEDULED);

    private volatile Future<?> pendingDelay;
    private volatile Future<?> runningCycle;

    public ObservationTask(String conversationId, String triggerMessageId, Instant startTime, Duration delay) {
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
        this.triggerMessageId = triggerMessageId;
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.delay = delay != null ? delay : Duration.ZERO;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getTriggerMessageId() {
        return triggerMessageId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getDelay() {
        return delay;
    }

    public ObservationState getState() {
        return state.get();
    }

    public boolean isStale() {
        return state.get() == ObservationState.STALE;
    }

    public boolean advance(ObservationState from, ObservationState to) {
        return state.compareAndSet(from, to);
    }

    public void attachPendingDelay(Future<?> handle) {
        this.pendingDelay = handle;
        if (isStale() && handle != null) {
            handle.cancel(false);
        }
    }

    public void attachRunningCycle(Future<?> handle) {
        this.runningCycle = handle;
        if (isStale() && handle != null) {
            handle.cancel(true);
        }
    }

    /**
     * Instant after which the task is considered stuck.
     */
    public Instant staleAfter(Duration grace) {
        return startTime.plus(delay).plus(grace);
    }

    /**
     * Forcibly ends the task: cancels the timer and interrupts a running cycle.
     * A task that is already sending its reply is left alone, so a reply is
     * never cut off halfway.
     *
     * @return {@code false} if the task had already finished or is replying
     */
    public boolean markStale() {
        while (true) {
            ObservationState current = state.get();
            if (current == ObservationState.IDLE || current == ObservationState.STALE
                    || current == ObservationState.REPLYING) {
                return false;
            }
            if (state.compareAndSet(current, ObservationState.STALE)) {
                break;
            }
        }
        Future<?> delayHandle = pendingDelay;
        if (delayHandle != null) {
            delayHandle.cancel(false);
        }
        Future<?> cycleHandle = runningCycle;
        if (cycleHandle != null) {
            cycleHandle.cancel(true);
        }
        return true;
    }

    /**
     * Cancels the timer without marking the task stale. Used on shutdown.
     */
    public void cancel() {
        Future<?> delayHandle = pendingDelay;
        if (delayHandle != null) {
            delayHandle.cancel(false);
        }
        Future<?> cycleHandle = runningCycle;
        if (cycleHandle != null) {
            cycleHandle.cancel(true);
        }
    }

    /**
     * Moves the task back to idle once its cycle has ended, whatever the outcome.
     */
    public void complete() {
        state.set(ObservationState.IDLE);
    }
}
