package ru.hedge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.hedge.dto.cycle.CycleResult;
import ru.hedge.dto.cycle.CycleState;
import ru.hedge.service.CycleOrchestrator;
import ru.hedge.service.SafetyMonitor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradingRunnerTest {

    @Mock
    private CycleOrchestrator orchestrator;
    @Mock
    private SafetyMonitor safetyMonitor;
    @InjectMocks
    private TradingRunner runner;

    @Test
    void singleSuccessfulCycleExitsCleanly() {
        when(orchestrator.runCycle()).thenReturn(result(true, CycleState.COOLDOWN));

        assertThat(runner.run(true)).isEqualTo(TradingRunner.EXIT_OK);
        verify(orchestrator).stop();
        assertThat(runner.isFinished()).isTrue();
        assertThat(runner.awaitCompletion(Duration.ZERO)).isTrue();
    }

    @Test
    void failedCycleExitsWithFailure() {
        when(orchestrator.runCycle()).thenReturn(result(false, CycleState.ERROR));

        assertThat(runner.run(true)).isEqualTo(TradingRunner.EXIT_FAILED);
    }

    @Test
    void emergencyHasItsOwnExitCode() {
        when(orchestrator.runCycle()).thenReturn(result(false, CycleState.EMERGENCY));
        when(safetyMonitor.isEmergencyTriggered()).thenReturn(true);

        assertThat(runner.run(true)).isEqualTo(TradingRunner.EXIT_EMERGENCY);
    }

    @Test
    void startFailureSkipsTrading() {
        doThrow(new IllegalStateException("Failed to connect to one or more venues")).when(orchestrator).start();

        assertThat(runner.run(false)).isEqualTo(TradingRunner.EXIT_FAILED);
        verify(orchestrator, never()).runContinuous();
        assertThat(runner.isFinished()).isTrue();
    }

    @Test
    void continuousRunStopsOrchestratorAfterwards() {
        assertThat(runner.run(false)).isEqualTo(TradingRunner.EXIT_OK);

        verify(orchestrator).runContinuous();
        verify(orchestrator).stop();
    }

    private static CycleResult result(boolean success, CycleState state) {
        return CycleResult.builder().cycleId("c1").success(success).state(state).build();
    }
}
