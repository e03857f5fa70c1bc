package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.Position;
import ru.hedge.dto.exchanges.OrderResult;
import ru.hedge.dto.safety.EmergencyAction;
import ru.hedge.dto.safety.EmergencyReason;
import ru.hedge.dto.safety.ExposureReport;
import ru.hedge.exchanges.Venue;
import ru.hedge.utils.SafetyState;
import ru.hedge.utils.TradingEventLogger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Watchdog running beside the cycles: failure ceiling, exposure reconciliation,
 * emergency liquidation and interrupt handling.
 */
@Slf4j
public class SafetyMonitor {

    private final Venue first;
    private final Venue second;
    private final SafetyState state;
    private final ScheduledExecutorService scheduler;
    private final TradingEventLogger events;
    private final Clock clock;
    private final int maxConsecutiveFailures;
    private final double sizeTolerance;
    private final long checkIntervalMs;

    private volatile Consumer<EmergencyAction> emergencyCallback;
    private volatile Runnable forceExit = () -> Runtime.getRuntime().halt(1);
    private volatile ScheduledFuture<?> loop;

    public SafetyMonitor(Venue first, Venue second, SafetyState state, ScheduledExecutorService scheduler,
                         TradingEventLogger events, Clock clock, HedgeConfig config) {
        this.first = first;
        this.second = second;
        this.state = state;
        this.scheduler = scheduler;
        this.events = events;
        this.clock = clock;
        this.maxConsecutiveFailures = config.getRisk().getMaxConsecutiveFailures();
        this.sizeTolerance = config.getSafety().getSizeTolerance();
        this.checkIntervalMs = config.getSafety().getCheckIntervalMs();
    }

    public void setEmergencyCallback(Consumer<EmergencyAction> emergencyCallback) {
        this.emergencyCallback = emergencyCallback;
    }

    public void setForceExit(Runnable forceExit) {
        this.forceExit = forceExit;
    }

    /**
     * @return true when this failure reached the ceiling; the emergency flag is then set for good
     */
    public boolean recordFailure() {
        int failures = state.incrementFailures();
        log.warn("[Safety] Consecutive failures: {}/{}", failures, maxConsecutiveFailures);
        if (failures >= maxConsecutiveFailures) {
            if (state.triggerEmergency()) {
                log.error("[Safety] Failure ceiling reached, treating as systemic fault");
            }
            return true;
        }
        return false;
    }

    public void recordSuccess() {
        state.resetFailures();
    }

    public void addMonitoredToken(String token) {
        state.addMonitoredToken(token);
    }

    public void removeMonitoredToken(String token) {
        state.removeMonitoredToken(token);
    }

    public boolean isEmergencyTriggered() {
        return state.isEmergencyTriggered();
    }

    public boolean isShutdownRequested() {
        return state.isShutdownRequested();
    }

    public SafetyState getState() {
        return state;
    }

    public ExposureReport checkExposure() {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<Position> firstPositions;
        List<Position> secondPositions;
        try {
            firstPositions = first.getPositions(null);
            secondPositions = second.getPositions(null);
        } catch (RuntimeException e) {
            log.error("[Safety] Exposure check failed: {}", e.getMessage());
            issues.add("Exposure check failed: " + e.getMessage());
            return ExposureReport.of(issues, warnings);
        }

        for (String token : state.getMonitoredTokens()) {
            Optional<Position> a = find(firstPositions, token);
            Optional<Position> b = find(secondPositions, token);

            if (a.isPresent() != b.isPresent()) {
                String message = String.format("Unhedged exposure on %s: %s=%s, %s=%s", token,
                        first.getName(), a.isPresent(), second.getName(), b.isPresent());
                log.error("[Safety] {}", message);
                issues.add(message);
                continue;
            }
            if (a.isEmpty()) {
                continue;
            }

            Position pa = a.get();
            Position pb = b.get();
            if (pa.getSide() == pb.getSide()) {
                String message = String.format("Same-side exposure on %s: both %s", token, pa.getSide());
                log.error("[Safety] {}", message);
                issues.add(message);
                continue;
            }

            double maxSize = Math.max(pa.getSize(), pb.getSize());
            double diff = Math.abs(pa.getSize() - pb.getSize());
            if (maxSize > 0 && diff / maxSize > sizeTolerance) {
                String message = String.format("Size imbalance on %s: %s=%s, %s=%s",
                        token, first.getName(), pa.getSize(), second.getName(), pb.getSize());
                log.warn("[Safety] {}", message);
                warnings.add(message);
            }
        }
        return ExposureReport.of(issues, warnings);
    }

    /**
     * Cancels all orders and closes all positions on both venues. A failure on one venue
     * never stops the sweep on the other.
     */
    public EmergencyAction executeEmergency(EmergencyReason reason) {
        state.triggerEmergency();
        log.error("[Safety] EMERGENCY initiated: {}", reason);
        events.event(TradingEventLogger.EMERGENCY, "phase", "start", "reason", reason.name());

        List<String> closed = new ArrayList<>();
        List<String> details = new ArrayList<>();
        int cancelled = 0;
        boolean success = true;

        for (Venue venue : List.of(first, second)) {
            try {
                int count = venue.cancelAllOrders(null);
                cancelled += count;
                details.add(venue.getName() + ": cancelled " + count + " orders");
            } catch (RuntimeException e) {
                log.error("[Safety] Failed to cancel orders on {}: {}", venue.getName(), e.getMessage());
                details.add(venue.getName() + " order cancel failed: " + e.getMessage());
                success = false;
            }
        }

        for (Venue venue : List.of(first, second)) {
            List<Position> positions;
            try {
                positions = venue.getPositions(null);
            } catch (RuntimeException e) {
                log.error("[Safety] Failed to get positions on {}: {}", venue.getName(), e.getMessage());
                details.add(venue.getName() + " positions unavailable: " + e.getMessage());
                success = false;
                continue;
            }
            for (Position position : positions) {
                try {
                    OrderResult result = venue.closePosition(position.getToken(), null);
                    if (result != null && result.isSuccess()) {
                        closed.add(venue.getName() + ":" + position.getSymbol());
                    } else {
                        log.error("[Safety] Close of {} rejected on {}: {}", position.getSymbol(), venue.getName(),
                                result != null ? result.getMessage() : "no result");
                        success = false;
                    }
                } catch (RuntimeException e) {
                    log.error("[Safety] Failed to close {} on {}: {}",
                            position.getSymbol(), venue.getName(), e.getMessage());
                    success = false;
                }
            }
        }

        EmergencyAction action = EmergencyAction.builder()
                .reason(reason)
                .timestamp(clock.instant())
                .positionsClosed(List.copyOf(closed))
                .ordersCancelled(cancelled)
                .success(success)
                .details(String.join("; ", details))
                .build();

        Consumer<EmergencyAction> callback = emergencyCallback;
        if (callback != null) {
            try {
                callback.accept(action);
            } catch (RuntimeException e) {
                log.error("[Safety] Emergency callback failed", e);
            }
        }

        events.event(TradingEventLogger.EMERGENCY, "phase", "complete", "reason", reason.name(),
                "positions_closed", closed.size(), "orders_cancelled", cancelled, "success", success);
        return action;
    }

    public boolean verifyAllClosed() {
        try {
            List<Position> a = first.getPositions(null);
            List<Position> b = second.getPositions(null);
            if (!a.isEmpty()) {
                log.warn("[Safety] {} still has {} positions", first.getName(), a.size());
                return false;
            }
            if (!b.isEmpty()) {
                log.warn("[Safety] {} still has {} positions", second.getName(), b.size());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.error("[Safety] Position verification failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * First interrupt asks for a graceful stop after the current cycle.
     * An interrupt while an emergency is running exits at once.
     */
    public void handleInterrupt() {
        log.warn("[Safety] Interrupt received, initiating graceful shutdown");
        state.requestShutdown();
        if (state.isEmergencyTriggered()) {
            log.warn("[Safety] Emergency already in progress, forcing exit");
            forceExit.run();
        }
    }

    public synchronized void runSafetyLoop() {
        if (loop != null && !loop.isDone()) {
            return;
        }
        log.info("[Safety] Safety loop started, interval {} ms", checkIntervalMs);
        loop = scheduler.scheduleWithFixedDelay(this::runSafetyCheck,
                checkIntervalMs, checkIntervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (loop != null) {
            loop.cancel(false);
            loop = null;
            log.info("[Safety] Safety loop stopped");
        }
    }

    public boolean isLoopRunning() {
        ScheduledFuture<?> current = loop;
        return current != null && !current.isDone();
    }

    /**
     * One pass of the periodic loop. Escalates to an emergency on unbalanced exposure or a lost connection.
     */
    public void runSafetyCheck() {
        if (state.isEmergencyTriggered()) {
            stop();
            return;
        }
        try {
            if (!state.getMonitoredTokens().isEmpty()) {
                if (state.isExecutionInFlight()) {
                    log.debug("[Safety] Open/close in progress, exposure check skipped");
                } else {
                    ExposureReport report = checkExposure();
                    if (!report.isBalanced()) {
                        executeEmergency(EmergencyReason.UNHEDGED_EXPOSURE);
                        stop();
                        return;
                    }
                }
            }
            for (Venue venue : List.of(first, second)) {
                if (!venue.isConnected()) {
                    log.error("[Safety] {} connection lost", venue.getName());
                    executeEmergency(EmergencyReason.CONNECTION_LOST);
                    stop();
                    return;
                }
            }
        } catch (RuntimeException e) {
            //Keep the loop alive, a thrown task would cancel the schedule
            log.error("[Safety] Safety check error", e);
        }
    }

    private static Optional<Position> find(List<Position> positions, String token) {
        return positions.stream()
                .filter(p -> token.equalsIgnoreCase(p.getToken()) && p.getSize() > 0)
                .findFirst();
    }
}
