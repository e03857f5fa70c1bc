package ru.hedge.dto.exchanges;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Position {
    private VenueType venue;
    private String token;
    private String symbol;
    private Direction side;
    private double size;
    private double entryPrice;
    private double markPrice;
    private double unrealizedPnl;
    private double realizedPnl;
    private double fundingAccumulated;
    private int leverage;
}
