package me.golemcore.chorus.domain.service;

import me.golemcore.chorus.domain.model.JanitorReport;
import me.golemcore.chorus.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CleanupJanitorTest {

    private static final Instant BASE_TIME = Instant.parse("2026-01-01T12:00:00Z");

    private MutableClock clock;
    private TopicChangeGate gate;
    private IntakeQueue queue;
    private ObservationScheduler scheduler;
    private CleanupJanitor janitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(BASE_TIME);
        gate = mock(TopicChangeGate.class);
        queue = mock(IntakeQueue.class);
        scheduler = mock(ObservationScheduler.class);
        janitor = new CleanupJanitor("Critic", gate, queue, scheduler, clock, Duration.ofMinutes(5),
                Duration.ofMinutes(1));
    }

    @Test
    void shouldRunEveryCleanupStep() {
        when(gate.expireParticipations(BASE_TIME)).thenReturn(2);
        when(gate.expireTopicCache(BASE_TIME)).thenReturn(1);
        when(gate.trimTopicCache()).thenReturn(3);
        when(queue.evictStale(BASE_TIME, Duration.ofMinutes(5))).thenReturn(4);
        when(scheduler.reapStale(BASE_TIME, Duration.ofMinutes(1))).thenReturn(1);

        JanitorReport report = janitor.sweep();

        assertFalse(report.skipped());
        assertEquals(2, report.participationsExpired());
        assertEquals(1, report.topicCacheExpired());
        assertEquals(3, report.topicCacheTrimmed());
        assertEquals(4, report.queueItemsEvicted());
        assertEquals(1, report.observationsReaped());
        assertEquals(11, report.total());
    }

    @Test
    void shouldSkipOverlappingSweep() {
        AtomicReference<JanitorReport> nested = new AtomicReference<>();
        when(gate.expireParticipations(any())).thenAnswer(invocation -> {
            nested.set(janitor.sweep());
            return 0;
        });

        JanitorReport outer = janitor.sweep();

        assertFalse(outer.skipped());
        assertTrue(nested.get().skipped());
    }

    @Test
    void shouldAllowNextSweepAfterFailure() {
        when(gate.expireParticipations(any())).thenThrow(new IllegalStateException("boom")).thenReturn(0);

        try {
            janitor.sweep();
        } catch (IllegalStateException expected) {
            // first sweep fails
        }

        assertFalse(janitor.sweep().skipped());
    }

    @Test
    void shouldScheduleAtFixedRateAndCancelOnStop() {
        ScheduledExecutorService timer = mock(ScheduledExecutorService.class);
        ScheduledFuture<?> handle = mock(ScheduledFuture.class);
        doReturn(handle).when(timer).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any());

        janitor.start(timer, Duration.ofSeconds(60));
        janitor.stop();

        verify(timer).scheduleAtFixedRate(any(Runnable.class), eq(60_000L), eq(60_000L),
                eq(TimeUnit.MILLISECONDS));
        verify(handle).cancel(false);
    }
}
