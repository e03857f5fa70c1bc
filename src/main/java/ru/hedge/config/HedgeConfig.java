package ru.hedge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import ru.hedge.dto.exchanges.VenueType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "hedge")
public class HedgeConfig {

    //Paper venues instead of live ones; live mode is refused with aggressive risk bounds
    private boolean simulationMode = true;
    private List<String> tokens = new ArrayList<>(List.of("BTC", "ETH", "SOL", "HYPE"));
    private VenuesConfig venues = new VenuesConfig();
    private RiskConfig risk = new RiskConfig();
    private FundingBiasConfig fundingBias = new FundingBiasConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private SafetyConfig safety = new SafetyConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private RetryConfig retry = new RetryConfig();
    private PaperConfig paper = new PaperConfig();
    private PnLConfig pnl = new PnLConfig();

    @Data
    public static class VenuesConfig {
        private VenueType first = VenueType.EXTENDED;
        private VenueType second = VenueType.TRADEXYZ;
    }

    @Data
    public static class RiskConfig {
        private double minEquityUsage = 0.40;
        private double maxEquityUsage = 0.80;
        private int minLeverage = 10;
        private int maxLeverage = 20;
        private int softLeverageThreshold = 15;
        private int minHoldSeconds = 1200;
        private int maxHoldSeconds = 7200;
        private int minCooldownSeconds = 600;
        private int maxCooldownSeconds = 3600;
        private double maxPositionValue = 100_000;
        private double minPositionValue = 10;
        private double minBalance = 100;
        private int maxConsecutiveFailures = 3;
        private double maxSlippagePercent = 0.5;
        private double safetyBuffer = 0.95;
        private double marginBufferRatio = 0.2;
        private double defaultMaintenanceMargin = 0.005;
    }

    @Data
    public static class FundingBiasConfig {
        private double minMeaningfulDiff = 0.00001;
        private double moderateThreshold = 0.0001;
        private double largeThreshold = 0.0005;
        private double smallWeight = 0.50;
        private double moderateWeight = 0.60;
        private double largeWeight = 0.75;
        //Unbiased coin flip when false
        private boolean enabled = true;
    }

    @Data
    public static class ExecutionConfig {
        private boolean parallelOpen = true;
        private long orderTimeoutMs = 60_000;
        private long apiTimeoutMs = 30_000;
        //How long a timed-out open waits for legs still in flight before giving up on them
        private long legSettleTimeoutMs = 30_000;
        private int sizePrecision = 4;
    }

    @Data
    public static class SafetyConfig {
        private long checkIntervalMs = 5_000;
        private long holdPollIntervalMs = 30_000;
        private double sizeTolerance = 0.01;
        private long shutdownWaitMs = 120_000;
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        private int requestsPerMinute = 60;
        private int burst = 5;
    }

    @Data
    public static class RetryConfig {
        private boolean enabled = true;
        private int maxAttempts = 3;
        private long initialBackoffMs = 1_000;
        private long maxBackoffMs = 10_000;
    }

    @Data
    public static class PaperConfig {
        private double balance = 10_000;
        private Map<String, Double> prices = new LinkedHashMap<>(Map.of(
                "BTC", 50_000.0, "ETH", 3_000.0, "SOL", 150.0, "HYPE", 25.0));
        private Map<VenueType, Double> fundingRates = new LinkedHashMap<>(Map.of(
                VenueType.EXTENDED, 0.0001, VenueType.TRADEXYZ, -0.00005));
        private double minOrderSize = 0.0001;
        private int maxLeverage = 50;
    }

    @Data
    public static class PnLConfig {
        private double feeRate = 0.0005;
    }
}
