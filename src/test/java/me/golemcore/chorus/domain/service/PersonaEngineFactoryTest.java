package me.golemcore.chorus.domain.service;

import me.golemcore.chorus.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class PersonaEngineFactoryTest {

    private BotProperties properties;
    private PersonaEngineFactory factory;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        factory = new PersonaEngineFactory(properties, mock(ConversationStore.class), mock(OracleService.class),
                mock(ParticipationDecider.class), mock(ReplyComposer.class), mock(ReplySender.class),
                mock(AttachmentFolder.class), Clock.systemUTC());
    }

    @Test
    void shouldRaiseGraceToCoverOneFullCycle() {
        properties.getEngine().setObservationGraceMs(60_000);
        properties.getOracle().setTimeoutMs(30_000);
        properties.getEngine().setSendTimeoutMs(30_000);

        assertEquals(Duration.ofMillis(120_000), factory.settings().observationGrace());
    }

    @Test
    void shouldKeepConfiguredGraceWhenLongEnough() {
        properties.getEngine().setObservationGraceMs(300_000);

        assertEquals(Duration.ofMillis(300_000), factory.settings().observationGrace());
    }

    @Test
    void shouldCoverDefaultTimeoutsWithDefaultGrace() {
        BotProperties.EngineProperties engine = properties.getEngine();
        long cycleBudget = 3 * properties.getOracle().getTimeoutMs() + engine.getSendTimeoutMs();

        assertEquals(Duration.ofMillis(engine.getObservationGraceMs()), factory.settings().observationGrace());
        assertTrue(engine.getObservationGraceMs() >= cycleBudget);
    }
}
