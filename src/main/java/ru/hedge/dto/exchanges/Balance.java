package ru.hedge.dto.exchanges;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Balance {
    private VenueType venue;
    private double balance;
    private double equity;
    private double availableForTrade;
    private double marginUsed;
    private double unrealizedPnl;
    @Builder.Default
    private String currency = "USD";
}
