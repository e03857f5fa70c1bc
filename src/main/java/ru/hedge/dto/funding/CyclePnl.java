package ru.hedge.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CyclePnl {
    double firstRealizedPnl;
    double secondRealizedPnl;
    double firstFunding;
    double secondFunding;
    double totalFees;
    double netPnl;

    public double getGrossPnl() {
        return firstRealizedPnl + secondRealizedPnl + firstFunding + secondFunding;
    }

    public double getTotalFunding() {
        return firstFunding + secondFunding;
    }

    public double getTotalRealizedPnl() {
        return firstRealizedPnl + secondRealizedPnl;
    }
}
