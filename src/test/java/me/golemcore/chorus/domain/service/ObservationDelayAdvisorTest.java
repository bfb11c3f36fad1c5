package me.golemcore.chorus.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.domain.model.ParticipationStrategy;
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ObservationDelayAdvisorTest {

    private static final RoleConfig CRITIC = RoleConfig.builder()
            .name("Critic")
            .description("a critic")
            .participationStrategy(ParticipationStrategy.ORACLE_DECIDES)
            .decisionPrompt("YES or NO?")
            .observationDelay(Duration.ZERO)
            .build();

    private OracleService oracleService;
    private StoragePort storagePort;
    private BotProperties properties;
    private ObservationDelayAdvisor advisor;

    @BeforeEach
    void setUp() {
        oracleService = mock(OracleService.class);
        storagePort = mock(StoragePort.class);
        properties = new BotProperties();
        advisor = new ObservationDelayAdvisor(oracleService, storagePort, new ObjectMapper(), properties);
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
    }

    @Test
    void shouldAskOracleAndPersistChoice() {
        when(storagePort.getText("personas", "observation-delays.json"))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenReturn("8 seconds feels right");

        RoleConfig resolved = advisor.ensureObservationDelay("critic", CRITIC);

        assertEquals(Duration.ofSeconds(8), resolved.getObservationDelay());
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort).putTextAtomic(eq("personas"), eq("observation-delays.json"), json.capture(),
                anyBoolean());
        assertTrue(json.getValue().contains("\"critic\" : 8000"));
    }

    @Test
    void shouldReuseCachedDelay() {
        when(storagePort.getText("personas", "observation-delays.json"))
                .thenReturn(CompletableFuture.completedFuture("{\"critic\": 12000}"));

        RoleConfig resolved = advisor.ensureObservationDelay("critic", CRITIC);

        assertEquals(Duration.ofSeconds(12), resolved.getObservationDelay());
        verifyNoInteractions(oracleService);
        verify(storagePort, never()).putTextAtomic(anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void shouldFallBackToDefaultWhenOracleFails() {
        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenThrow(new OracleException("down"));

        assertEquals(Duration.ofSeconds(5), advisor.ensureObservationDelay("critic", CRITIC).getObservationDelay());
    }

    @Test
    void shouldIgnoreCorruptCacheFile() {
        when(storagePort.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("not json"));
        when(oracleService.ask(anyString(), any(OracleContext.class))).thenReturn("3");

        assertEquals(Duration.ofSeconds(3), advisor.ensureObservationDelay("critic", CRITIC).getObservationDelay());
    }

    @Test
    void shouldLeaveConfiguredDelaysAlone() {
        RoleConfig configured = CRITIC.toBuilder().observationDelay(Duration.ofSeconds(9)).build();

        assertSame(configured, advisor.ensureObservationDelay("critic", configured));
        verifyNoInteractions(oracleService, storagePort);
    }

    @Test
    void shouldLeaveExpertsAndDisabledFeatureAlone() {
        RoleConfig expert = CRITIC.toBuilder().participationStrategy(ParticipationStrategy.ALWAYS_USER_QUESTION)
                .build();
        assertSame(expert, advisor.ensureObservationDelay("expert", expert));

        properties.getEngine().setOracleChosenDelay(false);
        assertSame(CRITIC, advisor.ensureObservationDelay("critic", CRITIC));
        verifyNoInteractions(oracleService);
    }

    @Test
    void shouldParseOnlyInRangeIntegers() {
        assertEquals(Duration.ofSeconds(2), ObservationDelayAdvisor.parseSeconds("2"));
        assertEquals(Duration.ofSeconds(15), ObservationDelayAdvisor.parseSeconds("15"));
        assertEquals(Duration.ofSeconds(5), ObservationDelayAdvisor.parseSeconds("1"));
        assertEquals(Duration.ofSeconds(5), ObservationDelayAdvisor.parseSeconds("30"));
        assertEquals(Duration.ofSeconds(5), ObservationDelayAdvisor.parseSeconds("-7"));
        assertEquals(Duration.ofSeconds(5), ObservationDelayAdvisor.parseSeconds("a few"));
        assertEquals(Duration.ofSeconds(5), ObservationDelayAdvisor.parseSeconds(null));
    }
}
