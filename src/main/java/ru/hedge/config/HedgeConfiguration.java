package ru.hedge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.hedge.dto.exchanges.VenueType;
import ru.hedge.exchanges.PaperVenue;
import ru.hedge.exchanges.Venue;
import ru.hedge.exchanges.factory.VenueFactory;
import ru.hedge.service.*;
import ru.hedge.utils.SafetyState;
import ru.hedge.utils.Sleeper;
import ru.hedge.utils.TradingEventLogger;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Configuration
public class HedgeConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService legExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(4, r -> {
            Thread thread = new Thread(r, "leg-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService safetyScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "safety-loop");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public SafetyState safetyState() {
        return new SafetyState();
    }

    @Bean
    public TradingEventLogger tradingEventLogger(ObjectProvider<ObjectMapper> objectMapper, Clock clock) {
        return new TradingEventLogger(objectMapper.getIfAvailable(ObjectMapper::new), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hedge", name = "simulation-mode", havingValue = "true", matchIfMissing = true)
    public Venue extendedPaperVenue(HedgeConfig config, Clock clock) {
        return new PaperVenue(VenueType.EXTENDED, config, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hedge", name = "simulation-mode", havingValue = "true", matchIfMissing = true)
    public Venue tradeXyzPaperVenue(HedgeConfig config, Clock clock) {
        return new PaperVenue(VenueType.TRADEXYZ, config, clock);
    }

    @Bean
    public VenueFactory venueFactory(ObjectProvider<Venue> venues, HedgeConfig config, Clock clock,
                                     Sleeper sleeper, SecureRandomSource randomSource) {
        return new VenueFactory(venues.orderedStream().collect(Collectors.toList()),
                config, clock, sleeper, randomSource);
    }

    @Bean
    public AtomicExecutor atomicExecutor(VenueFactory venueFactory, @Qualifier("legExecutor") ExecutorService legExecutor,
                                         SecureRandomSource randomSource, TradingEventLogger events,
                                         HedgeConfig config) {
        return new AtomicExecutor(venueFactory.getFirst(), venueFactory.getSecond(), legExecutor,
                randomSource, events, config.getExecution(), config.getRisk().getMaxSlippagePercent());
    }

    @Bean
    public SafetyMonitor safetyMonitor(VenueFactory venueFactory, SafetyState safetyState,
                                       ScheduledExecutorService safetyScheduler, TradingEventLogger events,
                                       Clock clock, HedgeConfig config) {
        return new SafetyMonitor(venueFactory.getFirst(), venueFactory.getSecond(), safetyState,
                safetyScheduler, events, clock, config);
    }

    @Bean
    public CycleOrchestrator cycleOrchestrator(VenueFactory venueFactory, SecureRandomSource randomSource,
                                               FundingAnalyzer fundingAnalyzer, PositionSizer sizer,
                                               RiskValidator riskValidator, PnlCalculator pnlCalculator,
                                               AtomicExecutor executor, SafetyMonitor safetyMonitor,
                                               TradingEventLogger events, ApplicationEventPublisher eventPublisher,
                                               Sleeper sleeper, Clock clock, HedgeConfig config) {
        return new CycleOrchestrator(venueFactory.getFirst(), venueFactory.getSecond(), randomSource,
                fundingAnalyzer, sizer, riskValidator, pnlCalculator, executor, safetyMonitor,
                events, eventPublisher, sleeper, clock, config);
    }
}
