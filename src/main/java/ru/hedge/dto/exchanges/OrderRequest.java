package ru.hedge.dto.exchanges;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class OrderRequest {
    private String token;
    private Direction side;
    private double quantity;
    @Builder.Default
    private OrderType type = OrderType.MARKET;
    private Double price;
    private Integer leverage;
    private boolean reduceOnly;
    @Builder.Default
    private TimeInForce timeInForce = TimeInForce.IOC;
    private String externalId;
}
