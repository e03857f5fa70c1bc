package ru.hedge.dto.funding;

import lombok.Builder;
import lombok.Value;
import ru.hedge.dto.exchanges.VenueType;

@Value
@Builder
public class FundingAnalysis {
    String token;
    VenueType firstVenue;
    VenueType secondVenue;
    double firstRate;
    double secondRate;
    long firstNextFunding;
    long secondNextFunding;

    double rateDifference;
    FundingBias bias;

    //Advisory only, the binding side choice is drawn by SecureRandomSource
    VenueType recommendedShort;
    VenueType recommendedLong;

    double expectedHourlyIncome;

    public boolean isFavorableForOptimization() {
        return bias != FundingBias.NONE;
    }

    public double rateOf(VenueType venue) {
        return venue == firstVenue ? firstRate : secondRate;
    }
}
