package me.golemcore.chorus.domain.service;

import me.golemcore.chorus.domain.model.ChannelSpec;
import me.golemcore.chorus.domain.model.ParticipationStrategy;
import me.golemcore.chorus.domain.model.PersonaStatus;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.domain.model.RoleOverrides;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.inbound.ChannelFactory;
import me.golemcore.chorus.port.inbound.ChannelPort;
import me.golemcore.chorus.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PersonaOrchestratorTest {

    private static final RoleConfig CRITIC = RoleConfig.builder()
            .name("Critic")
            .description("a critic")
            .participationStrategy(ParticipationStrategy.ORACLE_DECIDES)
            .observationDelay(Duration.ofSeconds(4))
            .decisionPrompt("YES or NO?")
            .build();

    private BotProperties properties;
    private RoleRegistry roleRegistry;
    private ObservationDelayAdvisor delayAdvisor;
    private PersonaEngineFactory engineFactory;
    private ChannelFactory telegramFactory;
    private PersonaOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        roleRegistry = mock(RoleRegistry.class);
        delayAdvisor = mock(ObservationDelayAdvisor.class);
        engineFactory = mock(PersonaEngineFactory.class);
        telegramFactory = mock(ChannelFactory.class);
        when(telegramFactory.getChannelType()).thenReturn("telegram");
        when(roleRegistry.resolve(anyString(), any(RoleOverrides.class))).thenReturn(CRITIC);
        when(delayAdvisor.ensureObservationDelay(anyString(), any(RoleConfig.class)))
                .thenAnswer(invocation -> invocation.getArgument(1));
        orchestrator = new PersonaOrchestrator(properties, roleRegistry, delayAdvisor, engineFactory,
                List.of(telegramFactory), new MutableClock(Instant.parse("2026-01-01T12:00:00Z")));
    }

    @Test
    void shouldStartConfiguredPersona() {
        properties.getPersonas().add(persona("critic", "token-1"));
        ChannelPort channel = mock(ChannelPort.class);
        when(telegramFactory.create(any(ChannelSpec.class))).thenReturn(channel);
        PersonaEngine engine = mock(PersonaEngine.class);
        when(engineFactory.create("critic", CRITIC, channel)).thenReturn(engine);

        orchestrator.startAll();

        ArgumentCaptor<ChannelSpec> spec = ArgumentCaptor.forClass(ChannelSpec.class);
        verify(telegramFactory).create(spec.capture());
        assertEquals(new ChannelSpec("critic", "telegram", "token-1"), spec.getValue());
        verify(engine).start();
        assertTrue(orchestrator.findEngine("critic").isPresent());
        PersonaStatus status = orchestrator.getStatuses().get(0);
        assertTrue(status.isConnected());
        assertEquals("Critic", status.getName());
    }

    @Test
    void shouldPassConfiguredOverridesToRegistry() {
        BotProperties.PersonaProperties persona = persona("critic", "token-1");
        persona.setName("Skeptic");
        persona.setObservationDelayMs(2500L);
        properties.getPersonas().add(persona);
        when(telegramFactory.create(any(ChannelSpec.class))).thenReturn(mock(ChannelPort.class));
        when(engineFactory.create(anyString(), any(), any())).thenReturn(mock(PersonaEngine.class));

        orchestrator.startAll();

        ArgumentCaptor<RoleOverrides> overrides = ArgumentCaptor.forClass(RoleOverrides.class);
        verify(roleRegistry).resolve(eq("critic"), overrides.capture());
        assertEquals("Skeptic", overrides.getValue().getName());
        assertEquals(Duration.ofMillis(2500), overrides.getValue().getObservationDelay());
    }

    @Test
    void shouldIsolateFailingPersona() {
        properties.getPersonas().add(persona("critic", null));
        properties.getPersonas().add(persona("thinker", "token-2"));
        ChannelPort channel = mock(ChannelPort.class);
        when(telegramFactory.create(any(ChannelSpec.class))).thenReturn(channel);
        when(engineFactory.create(anyString(), any(), any())).thenReturn(mock(PersonaEngine.class));

        orchestrator.startAll();

        List<PersonaStatus> statuses = orchestrator.getStatuses();
        assertEquals(2, statuses.size());
        assertEquals("critic", statuses.get(0).getPersonaId());
        assertFalse(statuses.get(0).isConnected());
        assertEquals("no token configured", statuses.get(0).getError());
        assertTrue(statuses.get(1).isConnected());
    }

    @Test
    void shouldReportChannelStartFailure() {
        properties.getPersonas().add(persona("critic", "bad-token"));
        when(telegramFactory.create(any(ChannelSpec.class))).thenReturn(mock(ChannelPort.class));
        PersonaEngine engine = mock(PersonaEngine.class);
        doThrow(new IllegalStateException("Unauthorized")).when(engine).start();
        when(engineFactory.create(anyString(), any(), any())).thenReturn(engine);

        orchestrator.startAll();

        assertEquals("Unauthorized", orchestrator.getStatuses().get(0).getError());
        assertTrue(orchestrator.findEngine("critic").isEmpty());
    }

    @Test
    void shouldRejectUnsupportedChannel() {
        BotProperties.PersonaProperties persona = persona("critic", "token");
        persona.setChannel("discord");
        properties.getPersonas().add(persona);

        orchestrator.startAll();

        assertEquals("unsupported channel discord", orchestrator.getStatuses().get(0).getError());
        verify(engineFactory, never()).create(anyString(), any(), any());
    }

    @Test
    void shouldRecordDisabledPersonaWithoutStartingIt() {
        BotProperties.PersonaProperties persona = persona("critic", "token");
        persona.setEnabled(false);
        properties.getPersonas().add(persona);

        orchestrator.startAll();

        assertEquals("disabled", orchestrator.getStatuses().get(0).getError());
        verify(telegramFactory, never()).create(any());
    }

    @Test
    void shouldStopAllEngines() {
        properties.getPersonas().add(persona("critic", "token-1"));
        when(telegramFactory.create(any(ChannelSpec.class))).thenReturn(mock(ChannelPort.class));
        PersonaEngine engine = mock(PersonaEngine.class);
        when(engine.getPersonaId()).thenReturn("critic");
        when(engine.getRole()).thenReturn(CRITIC);
        when(engineFactory.create(anyString(), any(), any())).thenReturn(engine);
        orchestrator.startAll();

        orchestrator.stopAll();

        verify(engine).stop();
        assertTrue(orchestrator.findEngine("critic").isEmpty());
        assertFalse(orchestrator.getStatuses().get(0).isConnected());
    }

    private static BotProperties.PersonaProperties persona(String id, String token) {
        BotProperties.PersonaProperties persona = new BotProperties.PersonaProperties();
        persona.setId(id);
        persona.setToken(token);
        return persona;
    }
}
