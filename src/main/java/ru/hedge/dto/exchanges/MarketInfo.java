package ru.hedge.dto.exchanges;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketInfo {
    private VenueType venue;
    private String token;
    private String symbol;

    //Prices
    private double markPrice;
    private double indexPrice;
    private double lastPrice;
    private double bidPrice;
    private double askPrice;

    //Funding
    private double fundingRate;
    private long nextFundingTime;

    //Trading limits
    private double minOrderSize;
    private double minOrderSizeChange;
    private int maxLeverage;
    private double maintenanceMarginRate;
}
