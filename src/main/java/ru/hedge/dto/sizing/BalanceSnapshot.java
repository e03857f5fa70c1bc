package ru.hedge.dto.sizing;

import lombok.Builder;
import lombok.Value;
import ru.hedge.dto.exchanges.Balance;
import ru.hedge.dto.exchanges.VenueType;

/**
 * Balance of one venue as seen at the start of a cycle. Never reused by the next cycle.
 */
@Value
@Builder
public class BalanceSnapshot {
    VenueType venue;
    double available;
    double equity;
    double marginUsed;
    @Builder.Default
    String currency = "USD";

    public static BalanceSnapshot of(Balance balance) {
        return BalanceSnapshot.builder()
                .venue(balance.getVenue())
                .available(balance.getAvailableForTrade())
                .equity(balance.getEquity())
                .marginUsed(balance.getMarginUsed())
                .currency(balance.getCurrency())
                .build();
    }
}
