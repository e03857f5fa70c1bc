package ru.hedge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.cycle.CycleResult;
import ru.hedge.dto.cycle.CycleState;
import ru.hedge.dto.exchanges.Direction;
import ru.hedge.dto.exchanges.VenueType;
import ru.hedge.dto.safety.EmergencyReason;
import ru.hedge.event.CycleFinishedEvent;
import ru.hedge.event.EmergencyEvent;
import ru.hedge.exchanges.ScriptedVenue;
import ru.hedge.utils.RecordingSleeper;
import ru.hedge.utils.SafetyState;
import ru.hedge.utils.TradingEventLogger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

/**
 * Full cycles against scripted venues with a sleeper that never blocks.
 */
@ExtendWith(MockitoExtension.class)
class CycleOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private static final int HOLD_SECONDS = 60;

    @Mock
    private ApplicationEventPublisher publisher;

    private ScriptedVenue extended;
    private ScriptedVenue tradeXyz;
    private HedgeConfig config;
    private SafetyState state;
    private RecordingSleeper sleeper;
    private ExecutorService legExecutor;
    private ScheduledExecutorService scheduler;
    private SafetyMonitor safety;

    @BeforeEach
    void setUp() {
        extended = new ScriptedVenue(VenueType.EXTENDED).fundingRate(0.0001);
        tradeXyz = new ScriptedVenue(VenueType.TRADEXYZ).fundingRate(-0.00005);

        config = new HedgeConfig();
        config.setTokens(List.of("BTC"));
        config.getRisk().setMinHoldSeconds(HOLD_SECONDS);
        config.getRisk().setMaxHoldSeconds(HOLD_SECONDS);
        config.getRisk().setMinCooldownSeconds(1);
        config.getRisk().setMaxCooldownSeconds(1);
        config.getExecution().setOrderTimeoutMs(5_000);
        config.getExecution().setApiTimeoutMs(1_000);

        state = new SafetyState();
        sleeper = new RecordingSleeper();
        legExecutor = Executors.newFixedThreadPool(4);
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        legExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    void successfulCycleOpensHoldsAndCloses() {
        config.getRisk().setMinEquityUsage(0.5);
        config.getRisk().setMaxEquityUsage(0.5);
        config.getRisk().setMinLeverage(10);
        config.getRisk().setMaxLeverage(10);
        CycleOrchestrator orchestrator = orchestrator();

        CycleResult result = orchestrator.runCycle();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getState()).isEqualTo(CycleState.COOLDOWN);
        assertThat(result.getToken()).isEqualTo("BTC");
        assertThat(result.getFirstSide()).isEqualTo(result.getSecondSide().opposite());
        assertThat(result.getHoldDurationSeconds()).isEqualTo(HOLD_SECONDS);
        assertThat(sleeper.totalMillis()).isEqualTo(HOLD_SECONDS * 1000L);
        //10,000 x 0.5 x 10 / 50,000 x 0.95
        assertThat(result.getPositionSize()).isCloseTo(0.95, within(1e-9));
        assertThat(result.getLeverage()).isEqualTo(10);
        assertThat(extended.getPlacedOrders()).hasSize(1);
        assertThat(tradeXyz.getPlacedOrders()).hasSize(1);
        assertThat(extended.getPlacedOrders().get(0).getQuantity())
                .isEqualTo(tradeXyz.getPlacedOrders().get(0).getQuantity());
        assertThat(extended.getPositions(null)).isEmpty();
        assertThat(tradeXyz.getPositions(null)).isEmpty();
        assertThat(state.getMonitoredTokens()).isEmpty();
        assertThat(orchestrator.getCurrentState()).isEqualTo(CycleState.COOLDOWN);
        assertThat(orchestrator.getLastResult()).isSameAs(result);
        verify(publisher).publishEvent(any(CycleFinishedEvent.class));
    }

    @Test
    void fundingEstimateProratesAnalyzedDifferential() {
        CycleResult result = orchestrator().runCycle();

        double periods = (double) HOLD_SECONDS / FundingAnalyzer.FUNDING_INTERVAL_SECONDS;
        double expected = result.getPositionValue() * 0.00015 * periods;
        double signed = result.getFirstSide() == Direction.SHORT ? expected : -expected;

        assertThat(result.getFundingAnalysis().getRateDifference()).isCloseTo(0.00015, within(1e-12));
        assertThat(result.getFundingEarned()).isCloseTo(expected, within(1e-9));
        //per-leg breakdown follows the sides actually taken
        assertThat(result.getPnl().getFirstFunding() + result.getPnl().getSecondFunding())
                .isCloseTo(signed, within(1e-9));
        assertThat(result.getPnl().getTotalFees()).isCloseTo(result.getPositionValue() * 0.002, within(1e-9));
    }

    @Test
    void sizingRejectionPlacesNoOrders() {
        extended.available(1);

        CycleResult result = orchestrator().runCycle();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getState()).isEqualTo(CycleState.ERROR);
        assertThat(result.getErrorMessage()).startsWith("Sizing rejected");
        assertThat(extended.getPlacedOrders()).isEmpty();
        assertThat(tradeXyz.getPlacedOrders()).isEmpty();
        assertThat(state.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    void riskRejectionPlacesNoOrders() {
        config.getRisk().setMinLeverage(30);
        config.getRisk().setMaxLeverage(30);

        CycleResult result = orchestrator().runCycle();

        assertThat(result.getState()).isEqualTo(CycleState.ERROR);
        assertThat(result.getRiskAssessment().canProceed()).isFalse();
        assertThat(result.getErrorMessage()).contains("liquidation_risk");
        assertThat(extended.getPlacedOrders()).isEmpty();
    }

    @Test
    void failedOpenIsRolledBackAndUnmonitored() {
        tradeXyz.rejectNextOrder("Insufficient margin");

        CycleResult result = orchestrator().runCycle();

        assertThat(result.getState()).isEqualTo(CycleState.ERROR);
        assertThat(result.getOpenResult().isRollbackPerformed()).isTrue();
        assertThat(extended.getPositions(null)).isEmpty();
        assertThat(state.getMonitoredTokens()).isEmpty();
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    void emergencyDuringOpenSweepsLegsThatFilledAfterIt() {
        CycleOrchestrator orchestrator = orchestrator();
        extended.orderDelayMs(600);
        tradeXyz.orderDelayMs(600);
        scheduler.schedule(() -> safety.executeEmergency(EmergencyReason.MANUAL_TRIGGER), 200, TimeUnit.MILLISECONDS);

        CycleResult result = orchestrator.runCycle();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getState()).isEqualTo(CycleState.EMERGENCY);
        assertThat(result.getCloseResult()).isNull();
        assertThat(extended.getPlacedOrders()).hasSize(1);
        assertThat(tradeXyz.getPlacedOrders()).hasSize(1);
        assertThat(extended.getPositions(null)).isEmpty();
        assertThat(tradeXyz.getPositions(null)).isEmpty();
        assertThat(state.getMonitoredTokens()).isEmpty();
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    void emergencyDuringHoldSkipsNormalClose() {
        sleeper.onSleep(n -> state.triggerEmergency());

        CycleResult result = orchestrator().runCycle();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getState()).isEqualTo(CycleState.EMERGENCY);
        assertThat(result.getCloseResult()).isNull();
        assertThat(sleeper.getSleeps()).hasSize(1);
        assertThat(extended.getCloseCalls()).isZero();
        assertThat(state.getConsecutiveFailures()).isZero();
    }

    @Test
    void shutdownDuringHoldClosesEarly() {
        sleeper.onSleep(n -> state.requestShutdown());

        CycleResult result = orchestrator().runCycle();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getHoldDurationSeconds()).isEqualTo(30);
        assertThat(extended.getCloseCalls()).isEqualTo(1);
    }

    @Test
    void failedCloseIsAnError() {
        extended.rejectNextClose("Venue maintenance");

        CycleResult result = orchestrator().runCycle();

        assertThat(result.getState()).isEqualTo(CycleState.ERROR);
        assertThat(result.getCloseResult().getFirstLeg().isSuccess()).isFalse();
        assertThat(result.getCloseResult().getSecondLeg().isSuccess()).isTrue();
        assertThat(state.getMonitoredTokens()).isEmpty();
    }

    @Test
    void venueExceptionBecomesFailedResult() {
        extended.failBalance(new IllegalStateException("503"));

        CycleResult result = orchestrator().runCycle();

        assertThat(result.getState()).isEqualTo(CycleState.ERROR);
        assertThat(result.getErrorMessage()).isEqualTo("503");
    }

    @Test
    void thirdFailureTriggersEmergencySweep() {
        extended.available(1);
        CycleOrchestrator orchestrator = orchestrator();

        orchestrator.runCycle();
        orchestrator.runCycle();
        assertThat(state.isEmergencyTriggered()).isFalse();
        orchestrator.runCycle();

        assertThat(state.isEmergencyTriggered()).isTrue();
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher, atLeastOnce()).publishEvent(events.capture());
        assertThat(events.getAllValues()).filteredOn(EmergencyEvent.class::isInstance)
                .singleElement()
                .satisfies(e -> assertThat(((EmergencyEvent) e).getAction().getReason())
                        .isEqualTo(EmergencyReason.CONSECUTIVE_FAILURES));
    }

    @Test
    void continuousOperationStopsOnEmergency() {
        extended.available(1);

        orchestrator().runContinuous();

        assertThat(state.isEmergencyTriggered()).isTrue();
        assertThat(state.getConsecutiveFailures()).isEqualTo(3);
    }

    @Test
    void continuousOperationStopsOnShutdownAfterCycle() {
        CycleOrchestrator orchestrator = orchestrator();
        sleeper.onSleep(n -> state.requestShutdown());

        orchestrator.runContinuous();

        assertThat(orchestrator.getLastResult().isSuccess()).isTrue();
        assertThat(extended.getPlacedOrders()).hasSize(1);
    }

    @Test
    void startConnectsAndStartsSafetyLoop() {
        CycleOrchestrator orchestrator = orchestrator();
        extended.setConnected(false);

        orchestrator.start();

        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(extended.isConnected()).isTrue();
        orchestrator.stop();
        assertThat(extended.isConnected()).isFalse();
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void startFailsWhenVenueDoesNotConnect() {
        tradeXyz.setConnectResult(false);

        assertThatThrownBy(() -> orchestrator().start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to connect");
    }

    @Test
    void liveModeRefusesAggressiveLeverage() {
        config.setSimulationMode(false);

        assertThatThrownBy(() -> orchestrator().start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("leverage");
    }

    private CycleOrchestrator orchestrator() {
        TradingEventLogger events = new TradingEventLogger(new ObjectMapper(), CLOCK);
        SecureRandomSource random = new SecureRandomSource(config);
        AtomicExecutor executor = new AtomicExecutor(extended, tradeXyz, legExecutor, random, events,
                config.getExecution(), config.getRisk().getMaxSlippagePercent());
        safety = new SafetyMonitor(extended, tradeXyz, state, scheduler, events, CLOCK, config);
        safety.setForceExit(() -> {
        });

        return new CycleOrchestrator(extended, tradeXyz, random,
                new FundingAnalyzer(config), new PositionSizer(config), new RiskValidator(config),
                new PnlCalculator(config), executor, safety, events, publisher, sleeper, CLOCK, config);
    }
}
