package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.VenueType;
import ru.hedge.dto.funding.FundingAnalysis;
import ru.hedge.dto.funding.FundingBias;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Side-effect-free reading of a funding rate pair. Positive rate means longs pay shorts,
 * so the venue with the higher rate is the better one to be short on.
 */
@Slf4j
@Service
public class FundingAnalyzer {

    public static final long FUNDING_INTERVAL_SECONDS = 8 * 60 * 60;

    private final HedgeConfig.FundingBiasConfig bias;
    private final VenueType firstVenue;
    private final VenueType secondVenue;

    public FundingAnalyzer(HedgeConfig config) {
        this.bias = config.getFundingBias();
        this.firstVenue = config.getVenues().getFirst();
        this.secondVenue = config.getVenues().getSecond();
    }

    public FundingAnalysis analyze(String token, double rateFirst, double rateSecond,
                                   long nextFundingFirst, long nextFundingSecond, double positionValue) {
        double diff = Math.abs(rateFirst - rateSecond);
        FundingBias category = classify(diff);

        boolean firstShort = rateFirst > rateSecond;
        VenueType shortVenue = firstShort ? firstVenue : secondVenue;
        VenueType longVenue = firstShort ? secondVenue : firstVenue;
        double shortRate = firstShort ? rateFirst : rateSecond;
        double longRate = firstShort ? rateSecond : rateFirst;

        double income = positionValue > 0 ? positionValue * (shortRate - longRate) : 0.0;

        FundingAnalysis analysis = FundingAnalysis.builder()
                .token(token)
                .firstVenue(firstVenue)
                .secondVenue(secondVenue)
                .firstRate(rateFirst)
                .secondRate(rateSecond)
                .firstNextFunding(nextFundingFirst)
                .secondNextFunding(nextFundingSecond)
                .rateDifference(diff)
                .bias(category)
                .recommendedShort(shortVenue)
                .recommendedLong(longVenue)
                .expectedHourlyIncome(income)
                .build();

        log.debug("[Funding] {} {}={} {}={} diff={} bias={} short={}",
                token, firstVenue.getDisplayName(), formatRate(rateFirst),
                secondVenue.getDisplayName(), formatRate(rateSecond),
                formatRate(diff), category, shortVenue.getDisplayName());
        return analysis;
    }

    public FundingBias classify(double rateDiff) {
        if (rateDiff < bias.getMinMeaningfulDiff()) {
            return FundingBias.NONE;
        }
        if (rateDiff < bias.getModerateThreshold()) {
            return FundingBias.SMALL;
        }
        if (rateDiff < bias.getLargeThreshold()) {
            return FundingBias.MODERATE;
        }
        return FundingBias.LARGE;
    }

    /**
     * Income per funding period for both possible assignments, keyed "first_short" and "first_long".
     */
    public Map<String, Double> compareAssignmentOutcomes(double rateFirst, double rateSecond, double positionValue) {
        Map<String, Double> outcomes = new LinkedHashMap<>();
        outcomes.put("first_short", positionValue * (rateFirst - rateSecond));
        outcomes.put("first_long", positionValue * (rateSecond - rateFirst));
        return outcomes;
    }

    public static String formatRate(double rate) {
        return String.format(Locale.ROOT, "%+.4f%%", rate * 100);
    }
}
