package ru.hedge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.hedge.dto.cycle.CycleResult;
import ru.hedge.service.CycleOrchestrator;
import ru.hedge.service.SafetyMonitor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the bot once (single cycle) or until shutdown/emergency, and reports an exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradingRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_EMERGENCY = 2;

    private final CycleOrchestrator orchestrator;
    private final SafetyMonitor safetyMonitor;
    private final CountDownLatch finished = new CountDownLatch(1);

    public int run(boolean singleCycle) {
        try {
            orchestrator.start();
        } catch (IllegalStateException e) {
            log.error("[Runner] Failed to start: {}", e.getMessage());
            finished.countDown();
            return EXIT_FAILED;
        }

        try {
            if (singleCycle) {
                CycleResult result = orchestrator.runCycle();
                if (result.isSuccess()) {
                    log.info("[Runner] Cycle {} succeeded: {} size {} held {}s, est. funding ${}",
                            result.getCycleId(), result.getToken(), result.getPositionSize(),
                            result.getHoldDurationSeconds(), String.format("%.4f", result.getFundingEarned()));
                } else {
                    log.warn("[Runner] Cycle {} failed ({}): {}",
                            result.getCycleId(), result.getState(), result.getErrorMessage());
                }
                return safetyMonitor.isEmergencyTriggered() ? EXIT_EMERGENCY
                        : result.isSuccess() ? EXIT_OK : EXIT_FAILED;
            }

            orchestrator.runContinuous();
            return safetyMonitor.isEmergencyTriggered() ? EXIT_EMERGENCY : EXIT_OK;
        } finally {
            orchestrator.stop();
            finished.countDown();
        }
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    /**
     * @return true if the run finished within the timeout
     */
    public boolean awaitCompletion(Duration timeout) {
        try {
            return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Runner] Interrupted while waiting for the cycle to finish");
            return false;
        }
    }
}
