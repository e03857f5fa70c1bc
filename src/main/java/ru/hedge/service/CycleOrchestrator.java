package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.cycle.CycleParameters;
import ru.hedge.dto.cycle.CycleResult;
import ru.hedge.dto.cycle.CycleState;
import ru.hedge.dto.cycle.SideAssignment;
import ru.hedge.dto.exchanges.Direction;
import ru.hedge.dto.exchanges.MarketInfo;
import ru.hedge.dto.execution.ExecutionResult;
import ru.hedge.dto.funding.CyclePnl;
import ru.hedge.dto.funding.FundingAnalysis;
import ru.hedge.dto.risk.RiskAssessment;
import ru.hedge.dto.safety.EmergencyReason;
import ru.hedge.dto.sizing.BalanceSnapshot;
import ru.hedge.dto.sizing.SizingResult;
import ru.hedge.event.CycleFinishedEvent;
import ru.hedge.event.EmergencyEvent;
import ru.hedge.exchanges.Venue;
import ru.hedge.utils.SafetyState;
import ru.hedge.utils.Sleeper;
import ru.hedge.utils.TradingEventLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives cycles: IDLE -> OPENING -> HOLDING -> CLOSING -> COOLDOWN, with ERROR and EMERGENCY as dead ends.
 * No exception leaves runCycle, every failure becomes a failed CycleResult.
 */
@Slf4j
public class CycleOrchestrator {

    private static final int COOLDOWN_JITTER_SECONDS = 60;
    private static final int LIVE_MAX_LEVERAGE = 10;
    private static final double LIVE_MAX_EQUITY_USAGE = 0.5;

    private final Venue first;
    private final Venue second;
    private final SecureRandomSource randomSource;
    private final FundingAnalyzer fundingAnalyzer;
    private final PositionSizer sizer;
    private final RiskValidator riskValidator;
    private final PnlCalculator pnlCalculator;
    private final AtomicExecutor executor;
    private final SafetyMonitor safety;
    private final TradingEventLogger events;
    private final ApplicationEventPublisher eventPublisher;
    private final Sleeper sleeper;
    private final Clock clock;
    private final HedgeConfig config;

    private volatile CycleState currentState = CycleState.IDLE;
    private volatile CycleResult lastResult;
    private volatile boolean running;
    private volatile Instant cycleStart;

    public CycleOrchestrator(Venue first, Venue second,
                             SecureRandomSource randomSource, FundingAnalyzer fundingAnalyzer,
                             PositionSizer sizer, RiskValidator riskValidator, PnlCalculator pnlCalculator,
                             AtomicExecutor executor, SafetyMonitor safety,
                             TradingEventLogger events, ApplicationEventPublisher eventPublisher,
                             Sleeper sleeper, Clock clock, HedgeConfig config) {
        this.first = first;
        this.second = second;
        this.randomSource = randomSource;
        this.fundingAnalyzer = fundingAnalyzer;
        this.sizer = sizer;
        this.riskValidator = riskValidator;
        this.pnlCalculator = pnlCalculator;
        this.executor = executor;
        this.safety = safety;
        this.events = events;
        this.eventPublisher = eventPublisher;
        this.sleeper = sleeper;
        this.clock = clock;
        this.config = config;

        safety.setEmergencyCallback(action -> eventPublisher.publishEvent(new EmergencyEvent(action)));
    }

    public void start() {
        log.info("[Orchestrator] Starting, venues {} / {}", first.getName(), second.getName());

        if (!config.isSimulationMode()) {
            HedgeConfig.RiskConfig risk = config.getRisk();
            log.warn("[Orchestrator] LIVE MODE ENABLED, leverage {}-{}x, equity {}-{}%",
                    risk.getMinLeverage(), risk.getMaxLeverage(),
                    Math.round(risk.getMinEquityUsage() * 100), Math.round(risk.getMaxEquityUsage() * 100));
            if (risk.getMaxLeverage() > LIVE_MAX_LEVERAGE) {
                throw new IllegalStateException("Live leverage too high: max " + risk.getMaxLeverage()
                        + "x, allowed up to " + LIVE_MAX_LEVERAGE + "x");
            }
            if (risk.getMaxEquityUsage() > LIVE_MAX_EQUITY_USAGE) {
                throw new IllegalStateException("Live equity usage too high: max " + risk.getMaxEquityUsage()
                        + ", allowed up to " + LIVE_MAX_EQUITY_USAGE);
            }
        }

        boolean firstConnected = connect(first);
        boolean secondConnected = connect(second);
        if (!firstConnected || !secondConnected) {
            throw new IllegalStateException("Failed to connect to one or more venues");
        }

        safety.runSafetyLoop();
        running = true;
        log.info("[Orchestrator] Started");
    }

    public void stop() {
        log.info("[Orchestrator] Stopping");
        running = false;
        safety.stop();
        disconnect(first);
        disconnect(second);
        log.info("[Orchestrator] Stopped");
    }

    public CycleResult runCycle() {
        String cycleId = UUID.randomUUID().toString().substring(0, 8);
        cycleStart = clock.instant();
        CycleResult.CycleResultBuilder result = CycleResult.builder()
                .cycleId(cycleId)
                .startTime(cycleStart);

        currentState = CycleState.IDLE;
        events.event(TradingEventLogger.CYCLE_START, "cycle_id", cycleId);

        try {
            //1. Parameters
            CycleParameters params = randomSource.generateCycleParameters(config.getTokens());
            String token = params.getToken();
            result.token(token)
                    .equityUsage(params.getEquityUsage())
                    .leverage(params.getLeverage())
                    .holdDurationSeconds(params.getHoldDurationSeconds());

            //2. Fresh balances and market data, never reused across cycles
            BalanceSnapshot firstBalance = BalanceSnapshot.of(first.getBalance());
            BalanceSnapshot secondBalance = BalanceSnapshot.of(second.getBalance());
            log.info("[Orchestrator] Balances: {} available=${} equity=${}, {} available=${} equity=${}",
                    first.getName(), fmt(firstBalance.getAvailable()), fmt(firstBalance.getEquity()),
                    second.getName(), fmt(secondBalance.getAvailable()), fmt(secondBalance.getEquity()));

            MarketInfo firstMarket = first.getMarketInfo(token);
            MarketInfo secondMarket = second.getMarketInfo(token);
            double price = firstMarket.getMarkPrice();

            //3. Funding analysis and side draw
            FundingAnalysis analysis = analyze(token, firstMarket, secondMarket, 0.0);
            events.event(TradingEventLogger.FUNDING_RATES, "token", token,
                    "first_rate", firstMarket.getFundingRate(), "second_rate", secondMarket.getFundingRate(),
                    "bias", analysis.getBias().name());

            SideAssignment sides = config.getFundingBias().isEnabled()
                    ? randomSource.assignSidesWithBias(firstMarket.getFundingRate(), secondMarket.getFundingRate())
                    : randomSource.assignSidesRandom();
            Direction firstSide = sides.getFirstSide();
            Direction secondSide = sides.getSecondSide();
            result.firstSide(firstSide).secondSide(secondSide).fundingAnalysis(analysis);
            events.event(TradingEventLogger.POSITION_ASSIGNMENT,
                    "first_side", firstSide.name(), "second_side", secondSide.name(),
                    "funding_favored", (analysis.getRecommendedShort() == analysis.getFirstVenue()) == sides.isFirstShort());

            //4. Sizing
            double minOrderSize = Math.max(firstMarket.getMinOrderSize(), secondMarket.getMinOrderSize());
            SizingResult sizing = sizer.calculateSize(token, price, firstBalance, secondBalance,
                    params.getEquityUsage(), params.getLeverage(), minOrderSize,
                    config.getExecution().getSizePrecision());
            result.sizingNotes(sizing.getConstraintNotes());
            if (!sizing.isFitsConstraints()) {
                return fail(result, CycleState.ERROR,
                        "Sizing rejected: " + String.join("; ", sizing.getConstraintNotes()));
            }
            result.positionSize(sizing.getPositionSize()).positionValue(sizing.getPositionValue());
            events.event(TradingEventLogger.SIZING_DECISION, "equity_usage", params.getEquityUsage(),
                    "leverage", params.getLeverage(), "position_size", sizing.getPositionSize(),
                    "position_value", sizing.getPositionValue());

            analysis = analyze(token, firstMarket, secondMarket, sizing.getPositionValue());
            result.fundingAnalysis(analysis);

            //5. Risk
            RiskAssessment risk = riskValidator.validatePreTrade(sizing, firstBalance, secondBalance, price,
                    maintenanceMargin(firstMarket), maintenanceMargin(secondMarket));
            result.riskAssessment(risk);
            if (!risk.canProceed()) {
                return fail(result, CycleState.ERROR, String.join("; ", risk.getBlockingIssues()));
            }

            //6. Open
            currentState = CycleState.OPENING;
            safety.addMonitoredToken(token);
            ExecutionResult open = withExecutionGuard(() -> executor.openPositions(token,
                    sizing.getPositionSize(), firstSide, secondSide, params.getLeverage(), price));
            result.openResult(open);
            //A sweep that ran while the legs were in flight saw nothing to close
            if (safety.isEmergencyTriggered()) {
                boolean flat = executor.emergencyRollback(token);
                safety.removeMonitoredToken(token);
                log.error("[Orchestrator] Emergency during open of {}, legs swept {}", token,
                        flat ? "clean" : "with failures");
                return finish(result, false, CycleState.EMERGENCY, flat
                        ? "Emergency triggered during open"
                        : "Emergency triggered during open, sweep incomplete");
            }
            if (!open.isSuccess()) {
                safety.removeMonitoredToken(token);
                if (open.isUnhedgedExposure()) {
                    log.error("[Orchestrator] Rollback failed for {}, leg left open", token);
                }
                return fail(result, CycleState.ERROR, open.getErrorMessage() != null ? open.getErrorMessage() : "Open failed");
            }

            //7. Hold
            currentState = CycleState.HOLDING;
            long heldSeconds = hold(params.getHoldDurationSeconds());
            result.holdDurationSeconds((int) heldSeconds);

            //8. Emergency during hold, the safety sweep owns the positions now
            if (safety.isEmergencyTriggered()) {
                log.error("[Orchestrator] Emergency during hold of {}, skipping normal close", token);
                return finish(result, false, CycleState.EMERGENCY, "Emergency triggered during hold");
            }

            //9. Close
            currentState = CycleState.CLOSING;
            ExecutionResult close;
            try {
                close = withExecutionGuard(() -> executor.closePositions(token, null, null));
            } finally {
                safety.removeMonitoredToken(token);
            }
            result.closeResult(close);
            if (!close.isSuccess()) {
                return fail(result, CycleState.ERROR, close.getErrorMessage() != null ? close.getErrorMessage() : "Close failed");
            }

            //10. Funding estimate: analyzed differential prorated over an 8h funding interval
            double periods = (double) heldSeconds / FundingAnalyzer.FUNDING_INTERVAL_SECONDS;
            double value = sizing.getPositionValue();
            double fundingEarned = value * analysis.getRateDifference() * periods;
            //Per-leg figures follow the sides actually taken and go to the P&L breakdown only
            double firstFunding = legFunding(value, firstMarket.getFundingRate(), firstSide, periods);
            double secondFunding = legFunding(value, secondMarket.getFundingRate(), secondSide, periods);
            CyclePnl pnl = pnlCalculator.calculateSimple(value, 0.0, 0.0, firstFunding, secondFunding);
            result.fundingEarned(fundingEarned).pnl(pnl);

            //11. Success
            safety.recordSuccess();
            return finish(result, true, CycleState.COOLDOWN, null);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Cycle {} failed with exception", cycleId, e);
            return fail(result, CycleState.ERROR, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    public void runContinuous() {
        SafetyState state = safety.getState();
        log.info("[Orchestrator] Continuous operation started");

        while (!state.isShutdownRequested() && !state.isEmergencyTriggered()) {
            CycleResult result = runCycle();
            if (!result.isSuccess()) {
                log.warn("[Orchestrator] Cycle {} failed: {}", result.getCycleId(), result.getErrorMessage());
            }
            if (state.isShutdownRequested() || state.isEmergencyTriggered()) {
                break;
            }

            currentState = CycleState.COOLDOWN;
            int cooldown = randomSource.generateCooldown() + randomSource.randomInt(0, COOLDOWN_JITTER_SECONDS);
            log.info("[Orchestrator] Cooldown {}s", cooldown);
            pause(cooldown * 1000L);
        }

        if (state.isEmergencyTriggered()) {
            log.warn("[Orchestrator] Emergency active, continuous operation halted");
        }
        log.info("[Orchestrator] Continuous operation ended");
    }

    public CycleState getCurrentState() {
        return currentState;
    }

    public CycleResult getLastResult() {
        return lastResult;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Polls the safety flags every hold-poll interval. Shutdown ends the hold early.
     *
     * @return seconds actually held
     */
    long hold(int seconds) {
        log.info("[Orchestrator] Holding for {}s", seconds);
        long elapsed = pause(seconds * 1000L);
        return elapsed / 1000;
    }

    private long pause(long totalMs) {
        long poll = config.getSafety().getHoldPollIntervalMs();
        long elapsed = 0;
        while (elapsed < totalMs) {
            if (safety.isShutdownRequested() || safety.isEmergencyTriggered()) {
                break;
            }
            long step = Math.min(poll, totalMs - elapsed);
            try {
                sleeper.sleep(Duration.ofMillis(step));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Orchestrator] Interrupted during sleep");
                break;
            }
            elapsed += step;
        }
        return elapsed;
    }

    private ExecutionResult withExecutionGuard(Supplier<ExecutionResult> action) {
        SafetyState state = safety.getState();
        state.beginExecution();
        try {
            return action.get();
        } finally {
            state.endExecution();
        }
    }

    private FundingAnalysis analyze(String token, MarketInfo firstMarket, MarketInfo secondMarket, double value) {
        return fundingAnalyzer.analyze(token, firstMarket.getFundingRate(), secondMarket.getFundingRate(),
                firstMarket.getNextFundingTime(), secondMarket.getNextFundingTime(), value);
    }

    private double maintenanceMargin(MarketInfo market) {
        return market.getMaintenanceMarginRate() > 0
                ? market.getMaintenanceMarginRate()
                : config.getRisk().getDefaultMaintenanceMargin();
    }

    //Positive rate: longs pay shorts
    private static double legFunding(double value, double rate, Direction side, double periods) {
        double sign = side == Direction.SHORT ? 1.0 : -1.0;
        return sign * value * rate * periods;
    }

    private CycleResult fail(CycleResult.CycleResultBuilder result, CycleState state, String error) {
        if (safety.recordFailure()) {
            log.error("[Orchestrator] Consecutive failure ceiling reached, triggering emergency");
            safety.executeEmergency(EmergencyReason.CONSECUTIVE_FAILURES);
        }
        return finish(result, false, state, error);
    }

    private CycleResult finish(CycleResult.CycleResultBuilder result, boolean success, CycleState state, String error) {
        Instant end = clock.instant();
        CycleResult built = result.success(success)
                .state(state)
                .errorMessage(error)
                .endTime(end)
                .totalDurationSeconds(Duration.between(cycleStart, end).toMillis() / 1000.0)
                .build();
        currentState = state;
        lastResult = built;

        events.event(TradingEventLogger.CYCLE_END, "cycle_id", built.getCycleId(), "success", success,
                "state", state.name(), "duration_seconds", built.getTotalDurationSeconds(),
                "funding_earned", built.getFundingEarned(),
                "error", error);
        if (success) {
            log.info("[Orchestrator] Cycle {} complete: {} estimated funding ${}",
                    built.getCycleId(), built.getToken(), fmt(built.getFundingEarned()));
        } else {
            log.warn("[Orchestrator] Cycle {} ended in {}: {}", built.getCycleId(), state, error);
        }

        try {
            eventPublisher.publishEvent(new CycleFinishedEvent(built));
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Failed to publish cycle result: {}", e.getMessage());
        }
        return built;
    }

    private boolean connect(Venue venue) {
        try {
            return venue.connect();
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Failed to connect to {}: {}", venue.getName(), e.getMessage());
            return false;
        }
    }

    private void disconnect(Venue venue) {
        try {
            venue.disconnect();
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Failed to disconnect from {}: {}", venue.getName(), e.getMessage());
        }
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }
}
