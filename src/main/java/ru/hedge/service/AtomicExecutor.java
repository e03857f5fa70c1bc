package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.Direction;
import ru.hedge.dto.exchanges.OrderRequest;
import ru.hedge.dto.exchanges.OrderResult;
import ru.hedge.dto.exchanges.OrderType;
import ru.hedge.dto.exchanges.TimeInForce;
import ru.hedge.dto.execution.ExecutionResult;
import ru.hedge.dto.execution.ExecutionState;
import ru.hedge.dto.execution.LegErrorType;
import ru.hedge.dto.execution.LegResult;
import ru.hedge.exceptions.VenueRejectedException;
import ru.hedge.exchanges.Venue;
import ru.hedge.utils.TradingEventLogger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Opens and closes the two legs of a hedge as one unit.
 * Either both legs end up open, or the one that did open is closed again.
 */
@Slf4j
public class AtomicExecutor {

    private final Venue first;
    private final Venue second;
    private final ExecutorService legExecutor;
    private final SecureRandomSource randomSource;
    private final TradingEventLogger events;
    private final long orderTimeoutMs;
    private final long apiTimeoutMs;
    private final long legSettleTimeoutMs;
    private final double maxSlippagePercent;

    private volatile boolean parallelOpen;
    private volatile ExecutionState currentState = ExecutionState.PENDING;

    public AtomicExecutor(Venue first, Venue second, ExecutorService legExecutor,
                          SecureRandomSource randomSource, TradingEventLogger events,
                          HedgeConfig.ExecutionConfig execution, double maxSlippagePercent) {
        this.first = first;
        this.second = second;
        this.legExecutor = legExecutor;
        this.randomSource = randomSource;
        this.events = events;
        this.orderTimeoutMs = execution.getOrderTimeoutMs();
        this.apiTimeoutMs = execution.getApiTimeoutMs();
        this.legSettleTimeoutMs = execution.getLegSettleTimeoutMs();
        this.maxSlippagePercent = maxSlippagePercent;
        this.parallelOpen = execution.isParallelOpen();
    }

    public ExecutionResult openPositions(String token, double size, Direction firstSide, Direction secondSide,
                                         int leverage, double price) {
        long started = System.nanoTime();
        currentState = ExecutionState.PENDING;
        log.info("[Executor] Opening {} size={} {}={} {}={} leverage={}x mode={}",
                token, size, first.getName(), firstSide, second.getName(), secondSide, leverage,
                parallelOpen ? "parallel" : "sequential");

        setLeverageOnBoth(token, leverage);

        AtomicReference<LegResult> firstLeg = new AtomicReference<>();
        AtomicReference<LegResult> secondLeg = new AtomicReference<>();
        CompletableFuture<Void> attempt = parallelOpen
                ? openParallel(token, size, firstSide, secondSide, price, firstLeg, secondLeg)
                : openSequential(token, size, firstSide, secondSide, price, firstLeg, secondLeg);

        try {
            attempt.get(orderTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("[Executor] Opening {} timed out after {} ms", token, orderTimeoutMs);
            return abortAfterTimeout(token, started, attempt,
                    orTimeout(firstLeg.get(), first, firstSide), orTimeout(secondLeg.get(), second, secondSide));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Executor] Interrupted while opening {}", token);
            sweepWhenSettled(token, attempt);
            return abortWithEmergencyRollback(token, started, attempt, "Interrupted",
                    orTimeout(firstLeg.get(), first, firstSide), orTimeout(secondLeg.get(), second, secondSide));
        } catch (ExecutionException e) {
            log.error("[Executor] Opening {} failed unexpectedly", token, e.getCause());
            String message = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            return abortWithEmergencyRollback(token, started, attempt, message,
                    orFailed(firstLeg.get(), first, firstSide, message),
                    orFailed(secondLeg.get(), second, secondSide, message));
        }

        LegResult a = firstLeg.get();
        LegResult b = secondLeg.get();
        if (a.isSuccess() && b.isSuccess()) {
            currentState = ExecutionState.COMPLETE;
            logOpened(a, size, price);
            logOpened(b, size, price);
            log.info("[Executor] {} hedge opened in {} ms", token, elapsedMs(started));
            return ExecutionResult.builder()
                    .success(true)
                    .state(ExecutionState.COMPLETE)
                    .firstLeg(a)
                    .secondLeg(b)
                    .executionTimeMs(elapsedMs(started))
                    .rollbackPerformed(false)
                    .rollbackSuccess(true)
                    .build();
        }
        return handleFailure(token, a, b, started);
    }

    /**
     * Closes both legs concurrently. Best effort, nothing is rolled back; both leg results are always filled.
     */
    public ExecutionResult closePositions(String token, Double sizeFirst, Double sizeSecond) {
        long started = System.nanoTime();
        log.info("[Executor] Closing {} on {} and {}", token, first.getName(), second.getName());

        CompletableFuture<LegResult> firstClose =
                CompletableFuture.supplyAsync(() -> closeLeg(first, token, sizeFirst), legExecutor);
        CompletableFuture<LegResult> secondClose =
                CompletableFuture.supplyAsync(() -> closeLeg(second, token, sizeSecond), legExecutor);

        try {
            CompletableFuture.allOf(firstClose, secondClose).get(orderTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("[Executor] Closing {} timed out after {} ms", token, orderTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Executor] Interrupted while closing {}", token);
        } catch (ExecutionException e) {
            log.error("[Executor] Unexpected error closing {}", token, e.getCause());
        }

        LegResult a = collect(firstClose, first);
        LegResult b = collect(secondClose, second);
        boolean both = a.isSuccess() && b.isSuccess();

        if (both) {
            log.info("[Executor] {} closed on both venues", token);
        } else if (a.isSuccess() || b.isSuccess()) {
            LegResult failed = a.isSuccess() ? b : a;
            log.warn("[Executor] {} closed on one venue only, {} failed: {}",
                    token, failed.getVenue().getDisplayName(), failed.getErrorMessage());
        } else {
            log.error("[Executor] Both closes failed for {}", token);
        }

        return ExecutionResult.builder()
                .success(both)
                .state(both ? ExecutionState.COMPLETE : ExecutionState.FAILED)
                .firstLeg(a)
                .secondLeg(b)
                .executionTimeMs(elapsedMs(started))
                .errorMessage(both ? null : "One or both closes failed")
                .rollbackPerformed(false)
                .rollbackSuccess(true)
                .build();
    }

    public ExecutionState getCurrentState() {
        return currentState;
    }

    public boolean isParallelOpen() {
        return parallelOpen;
    }

    public void setParallelOpen(boolean parallelOpen) {
        this.parallelOpen = parallelOpen;
    }

    private CompletableFuture<Void> openParallel(String token, double size, Direction firstSide, Direction secondSide,
                                                 double price, AtomicReference<LegResult> firstLeg,
                                                 AtomicReference<LegResult> secondLeg) {
        currentState = ExecutionState.OPENING_FIRST;
        CompletableFuture<Void> a = CompletableFuture
                .supplyAsync(() -> placeLeg(first, token, size, firstSide, price), legExecutor)
                .thenAccept(firstLeg::set);
        CompletableFuture<Void> b = CompletableFuture
                .supplyAsync(() -> placeLeg(second, token, size, secondSide, price), legExecutor)
                .thenAccept(secondLeg::set);
        return CompletableFuture.allOf(a, b);
    }

    private CompletableFuture<Void> openSequential(String token, double size, Direction firstSide, Direction secondSide,
                                                   double price, AtomicReference<LegResult> firstLeg,
                                                   AtomicReference<LegResult> secondLeg) {
        return CompletableFuture.runAsync(() -> {
            currentState = ExecutionState.OPENING_FIRST;
            LegResult a = placeLeg(first, token, size, firstSide, price);
            firstLeg.set(a);
            if (!a.isSuccess()) {
                secondLeg.set(LegResult.failed(second.getType(), secondSide, LegErrorType.NOT_ATTEMPTED,
                        "Not attempted - first leg failed"));
                return;
            }
            currentState = ExecutionState.OPENING_SECOND;
            secondLeg.set(placeLeg(second, token, size, secondSide, price));
        }, legExecutor);
    }

    private LegResult placeLeg(Venue venue, String token, double size, Direction side, double price) {
        OrderRequest request = OrderRequest.builder()
                .token(token)
                .side(side)
                .quantity(size)
                .type(OrderType.MARKET)
                .price(worstAcceptablePrice(side, price))
                .timeInForce(TimeInForce.IOC)
                .externalId(randomSource.generateExternalId())
                .build();
        try {
            OrderResult result = venue.placeOrder(request);
            LegResult leg = LegResult.of(venue.getType(), side, result);
            if (!leg.isSuccess()) {
                log.warn("[Executor] {} {} order rejected: {}", venue.getName(), side, leg.getErrorMessage());
            }
            return leg;
        } catch (VenueRejectedException e) {
            log.warn("[Executor] {} {} order rejected: {}", venue.getName(), side, e.getMessage());
            return LegResult.failed(venue.getType(), side, LegErrorType.EXCHANGE_REJECTED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Executor] {} {} order failed", venue.getName(), side, e);
            return LegResult.failed(venue.getType(), side, LegErrorType.UNEXPECTED_EXCEPTION, e.getMessage());
        }
    }

    private LegResult closeLeg(Venue venue, String token, Double quantity) {
        try {
            OrderResult result = venue.closePosition(token, quantity);
            LegResult leg = LegResult.of(venue.getType(), null, result);
            if (leg.isSuccess()) {
                events.event(TradingEventLogger.POSITION_CLOSED,
                        "venue", venue.getName(), "token", token,
                        "size", leg.getFilledQuantity(),
                        "exit_price", result.getAveragePrice());
            }
            return leg;
        } catch (VenueRejectedException e) {
            return LegResult.failed(venue.getType(), null, LegErrorType.EXCHANGE_REJECTED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Executor] Close on {} failed", venue.getName(), e);
            return LegResult.failed(venue.getType(), null, LegErrorType.UNEXPECTED_EXCEPTION, e.getMessage());
        }
    }

    private ExecutionResult handleFailure(String token, LegResult a, LegResult b, long started) {
        String errors = describeErrors(a, b);

        if (!a.isSuccess() && !b.isSuccess()) {
            currentState = ExecutionState.FAILED;
            log.warn("[Executor] Both legs failed for {}, nothing to roll back: {}", token, errors);
            return ExecutionResult.builder()
                    .success(false)
                    .state(ExecutionState.FAILED)
                    .firstLeg(a)
                    .secondLeg(b)
                    .executionTimeMs(elapsedMs(started))
                    .errorMessage(errors)
                    .rollbackPerformed(false)
                    .rollbackSuccess(false)
                    .build();
        }

        currentState = ExecutionState.ROLLING_BACK;
        Venue filled = a.isSuccess() ? first : second;
        log.warn("[Executor] Rolling back {} leg of {}", filled.getName(), token);

        boolean rolledBack;
        try {
            OrderResult close = filled.closePosition(token, null);
            rolledBack = close != null && close.isSuccess();
            if (!rolledBack) {
                log.error("[Executor] Rollback close rejected on {}: {}",
                        filled.getName(), close != null ? close.getMessage() : "no result");
            }
        } catch (RuntimeException e) {
            log.error("[Executor] Rollback close failed on {}", filled.getName(), e);
            rolledBack = false;
        }

        if (!rolledBack) {
            log.error("[Executor] UNHEDGED EXPOSURE: {} {} leg is still open on {}",
                    token, filled == first ? a.getSide() : b.getSide(), filled.getName());
        }

        currentState = rolledBack ? ExecutionState.ROLLED_BACK : ExecutionState.FAILED;
        return ExecutionResult.builder()
                .success(false)
                .state(currentState)
                .firstLeg(a)
                .secondLeg(b)
                .executionTimeMs(elapsedMs(started))
                .errorMessage(errors)
                .rollbackPerformed(true)
                .rollbackSuccess(rolledBack)
                .build();
    }

    private ExecutionResult abortWithEmergencyRollback(String token, long started, CompletableFuture<Void> attempt,
                                                       String error, LegResult a, LegResult b) {
        currentState = ExecutionState.ROLLING_BACK;
        //A leg still running can fill after the sweep
        boolean rolledBack = emergencyRollback(token) && attempt.isDone();
        currentState = ExecutionState.FAILED;
        if (!rolledBack) {
            log.error("[Executor] UNHEDGED EXPOSURE possible on {}: emergency rollback incomplete", token);
        }
        return ExecutionResult.builder()
                .success(false)
                .state(ExecutionState.FAILED)
                .firstLeg(a)
                .secondLeg(b)
                .executionTimeMs(elapsedMs(started))
                .errorMessage(error)
                .rollbackPerformed(true)
                .rollbackSuccess(rolledBack)
                .build();
    }

    /**
     * A leg that missed the order timeout may still fill afterwards. The first sweep cancels what rests,
     * then the legs get a bounded settle window and a second sweep closes whatever they produced.
     * Legs still unresolved after the window are swept when they finish and the rollback is reported failed.
     */
    private ExecutionResult abortAfterTimeout(String token, long started, CompletableFuture<Void> attempt,
                                              LegResult a, LegResult b) {
        currentState = ExecutionState.ROLLING_BACK;
        emergencyRollback(token);

        boolean settled = awaitSettle(token, attempt);
        boolean rolledBack;
        if (settled) {
            rolledBack = emergencyRollback(token);
        } else {
            sweepWhenSettled(token, attempt);
            rolledBack = false;
        }

        currentState = ExecutionState.FAILED;
        if (!rolledBack) {
            log.error("[Executor] UNHEDGED EXPOSURE possible on {}: {}", token,
                    settled ? "emergency rollback incomplete" : "legs still in flight after " + legSettleTimeoutMs + " ms");
        }
        return ExecutionResult.builder()
                .success(false)
                .state(ExecutionState.FAILED)
                .firstLeg(a)
                .secondLeg(b)
                .executionTimeMs(elapsedMs(started))
                .errorMessage("Execution timeout")
                .rollbackPerformed(true)
                .rollbackSuccess(rolledBack)
                .build();
    }

    private boolean awaitSettle(String token, CompletableFuture<Void> attempt) {
        try {
            attempt.get(legSettleTimeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException e) {
            //Legs finished, one of them exceptionally
            return true;
        } catch (TimeoutException e) {
            log.error("[Executor] Legs of {} still in flight after {} ms", token, legSettleTimeoutMs);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Executor] Interrupted while waiting for legs of {}", token);
            return false;
        }
    }

    private void sweepWhenSettled(String token, CompletableFuture<Void> attempt) {
        attempt.whenCompleteAsync((ignored, error) -> {
            log.warn("[Executor] Late legs of {} settled, sweeping again", token);
            if (!emergencyRollback(token)) {
                log.error("[Executor] UNHEDGED EXPOSURE: late sweep of {} incomplete", token);
            }
        }, legExecutor);
    }

    /**
     * Cancels everything then closes everything for the token on both venues.
     * Safe to repeat: with nothing open both steps are no-ops.
     */
    public boolean emergencyRollback(String token) {
        log.warn("[Executor] Emergency rollback for {}", token);
        boolean success = true;

        for (Venue venue : new Venue[]{first, second}) {
            try {
                venue.cancelAllOrders(token);
            } catch (RuntimeException e) {
                log.error("[Executor] Failed to cancel {} orders on {}", token, venue.getName(), e);
                success = false;
            }
        }
        for (Venue venue : new Venue[]{first, second}) {
            try {
                OrderResult result = venue.closePosition(token, null);
                if (result == null || !result.isSuccess()) {
                    success = false;
                }
            } catch (RuntimeException e) {
                log.error("[Executor] Failed to close {} on {}", token, venue.getName(), e);
                success = false;
            }
        }
        return success;
    }

    private void setLeverageOnBoth(String token, int leverage) {
        CompletableFuture<Void> a = CompletableFuture.runAsync(() -> setLeverage(first, token, leverage), legExecutor);
        CompletableFuture<Void> b = CompletableFuture.runAsync(() -> setLeverage(second, token, leverage), legExecutor);
        try {
            CompletableFuture.allOf(a, b).get(apiTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Executor] Interrupted while setting leverage");
        } catch (ExecutionException | TimeoutException e) {
            //Non-fatal, a wrong leverage shows up as an order failure
            log.warn("[Executor] Setting leverage {}x for {} did not complete: {}", leverage, token, e.toString());
        }
    }

    private void setLeverage(Venue venue, String token, int leverage) {
        try {
            if (!venue.setLeverage(token, leverage)) {
                log.warn("[Executor] {} refused leverage {}x for {}", venue.getName(), leverage, token);
            }
        } catch (RuntimeException e) {
            log.warn("[Executor] Failed to set leverage on {}: {}", venue.getName(), e.getMessage());
        }
    }

    private LegResult collect(CompletableFuture<LegResult> future, Venue venue) {
        if (!future.isDone()) {
            return LegResult.failed(venue.getType(), null, LegErrorType.TIMEOUT, "Close timed out");
        }
        try {
            return future.join();
        } catch (RuntimeException e) {
            return LegResult.failed(venue.getType(), null, LegErrorType.UNEXPECTED_EXCEPTION, e.getMessage());
        }
    }

    private void logOpened(LegResult leg, double size, double price) {
        double fill = leg.getOrderResult() != null && leg.getOrderResult().getAveragePrice() > 0
                ? leg.getOrderResult().getAveragePrice()
                : price;
        events.event(TradingEventLogger.POSITION_OPENED,
                "venue", leg.getVenue().getDisplayName(),
                "side", leg.getSide().name(),
                "size", size,
                "entry_price", fill);
    }

    private double worstAcceptablePrice(Direction side, double price) {
        double slippage = maxSlippagePercent / 100.0;
        return side == Direction.LONG ? price * (1 + slippage) : price * (1 - slippage);
    }

    private static LegResult orTimeout(LegResult leg, Venue venue, Direction side) {
        return leg != null ? leg : LegResult.failed(venue.getType(), side, LegErrorType.TIMEOUT, "Execution timeout");
    }

    private static LegResult orFailed(LegResult leg, Venue venue, Direction side, String message) {
        return leg != null ? leg : LegResult.failed(venue.getType(), side, LegErrorType.UNEXPECTED_EXCEPTION, message);
    }

    private static String describeErrors(LegResult a, LegResult b) {
        StringBuilder sb = new StringBuilder();
        for (LegResult leg : new LegResult[]{a, b}) {
            if (!leg.isSuccess()) {
                if (sb.length() > 0) {
                    sb.append("; ");
                }
                sb.append(leg.getVenue().getDisplayName()).append(": ").append(leg.getErrorMessage());
            }
        }
        return sb.toString();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
