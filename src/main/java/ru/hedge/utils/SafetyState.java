package ru.hedge.utils;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide safety flags shared by the orchestrator and the safety loop.
 * Emergency and shutdown are set-once; the failure counter only increments or resets.
 */
@Slf4j
public class SafetyState {

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicBoolean emergencyTriggered = new AtomicBoolean();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final Set<String> monitoredTokens = ConcurrentHashMap.newKeySet();
    //Open/close in progress, legs may be momentarily one-sided
    private final AtomicInteger executionsInFlight = new AtomicInteger();

    public int incrementFailures() {
        return consecutiveFailures.incrementAndGet();
    }

    public void resetFailures() {
        consecutiveFailures.set(0);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    /**
     * @return true if this call flipped the flag
     */
    public boolean triggerEmergency() {
        return emergencyTriggered.compareAndSet(false, true);
    }

    public boolean isEmergencyTriggered() {
        return emergencyTriggered.get();
    }

    public boolean requestShutdown() {
        return shutdownRequested.compareAndSet(false, true);
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    public void addMonitoredToken(String token) {
        if (monitoredTokens.add(token)) {
            log.info("[Safety] Now monitoring {}", token);
        }
    }

    public void removeMonitoredToken(String token) {
        if (monitoredTokens.remove(token)) {
            log.info("[Safety] Stopped monitoring {}", token);
        }
    }

    public Set<String> getMonitoredTokens() {
        return Collections.unmodifiableSet(monitoredTokens);
    }

    public void beginExecution() {
        executionsInFlight.incrementAndGet();
    }

    public void endExecution() {
        executionsInFlight.decrementAndGet();
    }

    public boolean isExecutionInFlight() {
        return executionsInFlight.get() > 0;
    }
}
