package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.cycle.CycleParameters;
import ru.hedge.dto.cycle.SideAssignment;

import java.security.SecureRandom;
import java.util.List;

/**
 * Cycle parameters, side choice and order tags drawn from OS entropy.
 * The generator is never seeded so cycles cannot be replayed or predicted from outside.
 */
@Slf4j
@Service
public class SecureRandomSource {

    static final int EQUITY_STEPS = 1000;
    private static final int WEIGHT_RESOLUTION = 1000;

    private final SecureRandom random = new SecureRandom();
    private final HedgeConfig.RiskConfig risk;
    private final HedgeConfig.FundingBiasConfig bias;

    public SecureRandomSource(HedgeConfig config) {
        this.risk = config.getRisk();
        this.bias = config.getFundingBias();
    }

    public CycleParameters generateCycleParameters(List<String> tokens) {
        CycleParameters params = CycleParameters.builder()
                .token(selectToken(tokens))
                .equityUsage(generateEquityUsage())
                .leverage(generateLeverage())
                .holdDurationSeconds(generateHoldDuration())
                .cooldownSeconds(generateCooldown())
                .build();

        log.info("[Random] Cycle parameters: token={}, equity={}%, leverage={}x, hold={}s, cooldown={}s",
                params.getToken(),
                String.format("%.1f", params.getEquityUsage() * 100),
                params.getLeverage(),
                params.getHoldDurationSeconds(),
                params.getCooldownSeconds());
        return params;
    }

    public String selectToken(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("No tokens configured");
        }
        return tokens.get(random.nextInt(tokens.size()));
    }

    /**
     * Uniform over 1000 steps of [min, max], both ends included.
     */
    public double generateEquityUsage() {
        double min = risk.getMinEquityUsage();
        double max = risk.getMaxEquityUsage();
        int step = random.nextInt(EQUITY_STEPS + 1);
        return min + (max - min) * step / EQUITY_STEPS;
    }

    public int generateLeverage() {
        return randomInt(risk.getMinLeverage(), risk.getMaxLeverage());
    }

    public int generateHoldDuration() {
        return randomInt(risk.getMinHoldSeconds(), risk.getMaxHoldSeconds());
    }

    public int generateCooldown() {
        return randomInt(risk.getMinCooldownSeconds(), risk.getMaxCooldownSeconds());
    }

    /**
     * Inclusive on both ends.
     */
    public int randomInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "]");
        }
        return min + random.nextInt(max - min + 1);
    }

    public SideAssignment assignSidesRandom() {
        return random.nextBoolean() ? SideAssignment.firstShort() : SideAssignment.firstLong();
    }

    /**
     * Weighted draw favouring the higher-rate venue as SHORT. The favourable side is never taken deterministically.
     */
    public SideAssignment assignSidesWithBias(double rateFirst, double rateSecond) {
        double weight = favourableWeight(Math.abs(rateFirst - rateSecond));
        boolean firstShouldShort = rateFirst > rateSecond;

        int threshold = (int) (weight * WEIGHT_RESOLUTION);
        boolean takeFavourable = random.nextInt(WEIGHT_RESOLUTION) < threshold;

        boolean firstShort = takeFavourable == firstShouldShort;
        SideAssignment assignment = firstShort ? SideAssignment.firstShort() : SideAssignment.firstLong();

        log.debug("[Random] Biased assignment: diff={}, weight={}, favourable={}, firstSide={}",
                Math.abs(rateFirst - rateSecond), weight, takeFavourable, assignment.getFirstSide());
        return assignment;
    }

    double favourableWeight(double rateDiff) {
        if (rateDiff < bias.getModerateThreshold()) {
            return bias.getSmallWeight();
        }
        if (rateDiff < bias.getLargeThreshold()) {
            return bias.getModerateWeight();
        }
        return bias.getLargeWeight();
    }

    public long generateNonce() {
        return random.nextLong();
    }

    /**
     * 128 bits as 32 lowercase hex chars
     */
    public String generateExternalId() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        StringBuilder sb = new StringBuilder(32);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
