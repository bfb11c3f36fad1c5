package me.golemcore.chorus.domain.service;

import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.domain.model.ObservationOutcome;
import me.golemcore.chorus.domain.model.ObservationTask;
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.domain.model.ParticipationStrategy;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.domain.model.StoredMessage;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.inbound.ChannelPort;
import me.golemcore.chorus.port.outbound.AttachmentPort;
import me.golemcore.chorus.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ObservationSchedulerTest {

    private static final Instant BASE_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final String CHAT = "chat-1";
    private static final String DECISION_PROMPT = "Is there a flaw nobody mentioned? Answer only YES or NO.";

    private static final RoleConfig CRITIC = RoleConfig.builder()
            .name("Critic")
            .description("a constructive critic")
            .participationStrategy(ParticipationStrategy.ORACLE_DECIDES)
            .observationDelay(Duration.ofSeconds(3))
            .decisionPrompt(DECISION_PROMPT)
            .maxObservationMessages(10)
            .build();

    private MutableClock clock;
    private ConversationStore store;
    private OracleService oracleService;
    private ChannelPort channel;
    private ScheduledExecutorService timer;
    private ExecutorService workers;
    private List<Runnable> timerTasks;
    private List<ScheduledFuture<?>> timerHandles;
    private List<String> oraclePrompts;
    private TopicChangeGate gate;
    private EngineServices services;
    private ObservationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(BASE_TIME);
        store = new ConversationStore(clock, Duration.ofMinutes(10), 50, Duration.ofMinutes(1));
        oracleService = mock(OracleService.class);
        channel = mock(ChannelPort.class);
        when(channel.getMaxMessageLength()).thenReturn(4000);
        when(channel.sendMessage(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));

        timerTasks = new ArrayList<>();
        timerHandles = new ArrayList<>();
        timer = mock(ScheduledExecutorService.class);
        when(timer.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
            timerTasks.add(invocation.getArgument(0));
            ScheduledFuture<?> handle = mock(ScheduledFuture.class);
            timerHandles.add(handle);
            return handle;
        });

        workers = mock(ExecutorService.class);
        when(workers.submit(any(Callable.class))).thenAnswer(invocation -> {
            Callable<?> callable = invocation.getArgument(0);
            return CompletableFuture.completedFuture(callable.call());
        });
        when(workers.submit(any(Runnable.class))).thenAnswer(invocation -> {
            Runnable runnable = invocation.getArgument(0);
            runnable.run();
            return CompletableFuture.completedFuture(null);
        });

        oraclePrompts = new ArrayList<>();
        BotProperties properties = new BotProperties();
        properties.getEngine().setSendTimeoutMs(1000);
        services = new EngineServices(oracleService, new ParticipationDecider(oracleService),
                new ReplyComposer(properties), new ReplySender(properties),
                new AttachmentFolder(mock(AttachmentPort.class)));
        gate = new TopicChangeGate("Critic", oracleService, clock, Duration.ofHours(1), Duration.ofHours(1), 100);
        scheduler = new ObservationScheduler(CRITIC, store, gate, services, channel, timer, workers, clock);
    }

    @Test
    void shouldObserveOnlyTheTriggeringThread() {
        answerOracle("YES", "YES", "Paris is right, though the question is worth a source.");

        InboundMessage france = userMessage("1", "What is the capital of France?");
        store.record(CHAT, "Alice", france.getContent(), false, "1", false);
        assertTrue(scheduler.schedule(france));

        store.record(CHAT, "Expert", "Paris.", true, "2", false);
        InboundMessage math = userMessage("3", "What is 2+2?");
        store.record(CHAT, "Alice", math.getContent(), false, "3", false);
        assertFalse(scheduler.schedule(math));

        fireTimer(0);

        String decisionPrompt = oraclePrompts.stream().filter(p -> p.endsWith(DECISION_PROMPT)).findFirst()
                .orElseThrow();
        assertTrue(decisionPrompt.contains("What is the capital of France?"));
        assertTrue(decisionPrompt.contains("Expert [Bot]: Paris."));
        assertFalse(decisionPrompt.contains("2+2"));

        verify(channel).sendMessage(eq(CHAT),
                eq("**Critic's take:**\n\nParis is right, though the question is worth a source."), isNull());
        assertEquals(0, scheduler.pendingCount());
        assertEquals("What is the capital of France?", gate.lastParticipation(CHAT).orElseThrow().topicSummary());

        List<StoredMessage> history = store.getHistory(CHAT, 10, null);
        StoredMessage last = history.get(history.size() - 1);
        assertEquals("Critic", last.getAuthor());
        assertTrue(last.isBot());
    }

    @Test
    void shouldCompareTopicsOnNextObservationAfterSpeaking() {
        answerOracle("YES", "YES", "A reply.");
        InboundMessage france = userMessage("1", "What is the capital of France?");
        store.record(CHAT, "Alice", france.getContent(), false, "1", false);
        scheduler.schedule(france);
        fireTimer(0);

        InboundMessage math = userMessage("3", "What is 2+2?");
        store.record(CHAT, "Alice", math.getContent(), false, "3", false);
        assertTrue(scheduler.schedule(math));
        fireTimer(1);

        assertTrue(oraclePrompts.stream().anyMatch(p -> p.contains("Topic A (when you last spoke):\n"
                + "What is the capital of France?") && p.contains("Topic B (now):\nWhat is 2+2?")));
        assertEquals("What is 2+2?", gate.lastParticipation(CHAT).orElseThrow().topicSummary());
    }

    @Test
    void shouldSkipWhenTopicUnchanged() {
        answerOracle("NO", "YES", "A reply.");
        gate.recordParticipation(CHAT, "What is the capital of France?");
        InboundMessage again = userMessage("5", "What is the capital of France?");
        store.record(CHAT, "Alice", again.getContent(), false, "5", false);

        scheduler.schedule(again);
        ObservationOutcome outcome = scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow());

        assertEquals(ObservationOutcome.DECLINED_TOPIC_UNCHANGED, outcome);
        verify(channel, never()).sendMessage(anyString(), anyString(), any());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void shouldStaySilentWhenOracleDeclines() {
        answerOracle("YES", "NO", "unused");
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        scheduler.schedule(question);

        ObservationOutcome outcome = scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow());

        assertEquals(ObservationOutcome.DECLINED_BY_ORACLE, outcome);
        verify(channel, never()).sendMessage(anyString(), anyString(), any());
        assertTrue(gate.lastParticipation(CHAT).isEmpty());
    }

    @Test
    void shouldReportNoHistory() {
        scheduler.schedule(userMessage("9", "not recorded"));

        assertEquals(ObservationOutcome.NO_HISTORY, scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow()));
    }

    @Test
    void shouldIgnoreBotTriggers() {
        InboundMessage fromBot = userMessage("1", "hi").toBuilder().bot(true).build();

        assertFalse(scheduler.schedule(fromBot));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void shouldNeverReplyAfterBeingMarkedStale() {
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        scheduler.schedule(question);
        ObservationTask task = scheduler.findTask(CHAT).orElseThrow();
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.endsWith(DECISION_PROMPT)) {
                return "YES";
            }
            task.markStale();
            return "late reply";
        });

        ObservationOutcome outcome = scheduler.runCycle(task);

        assertEquals(ObservationOutcome.STALE, outcome);
        verify(channel, never()).sendMessage(anyString(), anyString(), any());
    }

    @Test
    void shouldReapObservationsPastDelayAndGrace() {
        scheduler.schedule(userMessage("1", "hello"));
        clock.advance(Duration.ofSeconds(30));
        assertEquals(0, scheduler.reapStale(clock.instant(), Duration.ofMinutes(1)));

        clock.advance(Duration.ofMinutes(1));
        int reaped = scheduler.reapStale(clock.instant(), Duration.ofMinutes(1));

        assertEquals(1, reaped);
        assertEquals(0, scheduler.pendingCount());
        verify(timerHandles.get(0)).cancel(false);
    }

    @Test
    void shouldReportFailureWhenNothingWasDelivered() {
        answerOracle("YES", "YES", "A reply.");
        when(channel.sendMessage(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("blocked")));
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        scheduler.schedule(question);

        ObservationOutcome outcome = scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow());

        assertEquals(ObservationOutcome.FAILED, outcome);
        assertTrue(gate.lastParticipation(CHAT).isEmpty());
    }

    @Test
    void shouldFailGracefullyWhenReplyOracleFails() {
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.endsWith(DECISION_PROMPT)) {
                return "YES";
            }
            throw new OracleException("timeout");
        });
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        scheduler.schedule(question);

        assertEquals(ObservationOutcome.FAILED, scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow()));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void shouldDecideOnHistoryRefreshedAfterTopicGate() {
        gate.recordParticipation(CHAT, "Deploy windows");
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        scheduler.schedule(question);
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            oraclePrompts.add(prompt);
            if (prompt.contains("Is Topic B a different topic")) {
                store.record(CHAT, "Thinker", "Fridays are risky.", true, "2", false);
                return "YES";
            }
            return prompt.endsWith(DECISION_PROMPT) ? "NO" : "unused";
        });

        ObservationOutcome outcome = scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow());

        assertEquals(ObservationOutcome.DECLINED_BY_ORACLE, outcome);
        String decisionPrompt = oraclePrompts.stream().filter(p -> p.endsWith(DECISION_PROMPT)).findFirst()
                .orElseThrow();
        assertTrue(decisionPrompt.contains("Thinker [Bot]: Fridays are risky."));
    }

    @Test
    void shouldRefreshAgainBeforeReplyingWhenRoleAsksForIt() {
        RoleConfig thinker = CRITIC.toBuilder().name("Thinker").refreshBeforeReply(true).build();
        ObservationScheduler refreshing = newScheduler(thinker);

        List<String> replyPrompts = runWithMessageDuringDecision(refreshing);

        assertEquals(1, replyPrompts.size());
        assertTrue(replyPrompts.get(0).contains("Critic [Bot]: One more thing."));
    }

    @Test
    void shouldReplyFromDecisionHistoryWithoutExtraRefresh() {
        List<String> replyPrompts = runWithMessageDuringDecision(scheduler);

        assertEquals(1, replyPrompts.size());
        assertFalse(replyPrompts.get(0).contains("One more thing."));
    }

    @Test
    void shouldLetReplyInProgressFinishWhenReaped() {
        answerOracle("YES", "YES", "A reply.");
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        scheduler.schedule(question);
        List<Integer> reapedDuringSend = new ArrayList<>();
        when(channel.sendMessage(anyString(), anyString(), any())).thenAnswer(invocation -> {
            reapedDuringSend.add(scheduler.reapStale(clock.instant().plus(Duration.ofHours(1)),
                    Duration.ofMinutes(1)));
            return CompletableFuture.completedFuture(null);
        });

        ObservationOutcome outcome = scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow());

        assertEquals(ObservationOutcome.REPLIED, outcome);
        assertEquals(List.of(0), reapedDuringSend);
        assertTrue(gate.lastParticipation(CHAT).isPresent());
    }

    @Test
    void shouldNotRecordReplyThatWasNeverDelivered() {
        answerOracle("YES", "YES", "A reply.");
        when(channel.sendMessage(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("blocked")));
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        scheduler.schedule(question);

        scheduler.runCycle(scheduler.findTask(CHAT).orElseThrow());

        List<StoredMessage> history = store.getHistory(CHAT, 10, null);
        assertEquals(1, history.size());
        assertEquals("Alice", history.get(0).getAuthor());
    }

    @Test
    void shouldKeepSingleObservationUnderConcurrentBurst() throws Exception {
        RoleConfig slow = CRITIC.toBuilder().observationDelay(Duration.ofHours(1)).build();
        ScheduledExecutorService realTimer = Executors.newSingleThreadScheduledExecutor();
        ExecutorService realWorkers = Executors.newFixedThreadPool(4);
        ExecutorService senders = Executors.newFixedThreadPool(8);
        ObservationScheduler burstScheduler = new ObservationScheduler(slow, store, gate, services, channel,
                realTimer, realWorkers, clock);
        try {
            int burst = 32;
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < burst; i++) {
                InboundMessage message = userMessage("m" + i, "message " + i);
                results.add(senders.submit(() -> {
                    start.await();
                    return burstScheduler.schedule(message);
                }));
            }
            start.countDown();

            int scheduled = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    scheduled++;
                }
            }

            assertEquals(1, scheduled);
            assertEquals(1, burstScheduler.pendingCount());
        } finally {
            burstScheduler.shutdown();
            senders.shutdownNow();
            realWorkers.shutdownNow();
            realTimer.shutdownNow();
        }
    }

    @Test
    void shouldScheduleWithRoleDelay() {
        scheduler.schedule(userMessage("1", "hello"));

        verify(timer).schedule(any(Runnable.class), eq(3000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldCancelPendingTimersOnShutdown() {
        scheduler.schedule(userMessage("1", "hello"));

        scheduler.shutdown();

        assertEquals(0, scheduler.pendingCount());
        verify(timerHandles.get(0)).cancel(false);
    }

    private List<String> runWithMessageDuringDecision(ObservationScheduler target) {
        List<String> replyPrompts = new ArrayList<>();
        InboundMessage question = userMessage("1", "Should we ship on Friday?");
        store.record(CHAT, "Alice", question.getContent(), false, "1", false);
        target.schedule(question);
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.endsWith(DECISION_PROMPT)) {
                store.record(CHAT, "Critic", "One more thing.", true, "2", false);
                return "YES";
            }
            replyPrompts.add(prompt);
            return "A reply.";
        });

        assertEquals(ObservationOutcome.REPLIED, target.runCycle(target.findTask(CHAT).orElseThrow()));
        return replyPrompts;
    }

    private ObservationScheduler newScheduler(RoleConfig role) {
        return new ObservationScheduler(role, store, gate, services, channel, timer, workers, clock);
    }

    private void fireTimer(int index) {
        timerTasks.get(index).run();
    }

    private void answerOracle(String topicAnswer, String decisionAnswer, String reply) {
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            oraclePrompts.add(prompt);
            if (prompt.contains("Is Topic B a different topic")) {
                return topicAnswer;
            }
            if (prompt.endsWith(DECISION_PROMPT)) {
                return decisionAnswer;
            }
            return reply;
        });
    }

    private static InboundMessage userMessage(String id, String text) {
        return InboundMessage.builder()
                .conversationId(CHAT)
                .messageId(id)
                .author("Alice")
                .content(text)
                .build();
    }
}
