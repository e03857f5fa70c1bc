package ru.hedge.dto.exchanges;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OrderResult {
    private VenueType venue;
    private String symbol;
    private boolean success;
    private String orderId;
    private String externalId;
    private double filledQuantity;
    private double averagePrice;
    private String message;
    private String errorCode;
    private Long timestamp;

    public static OrderResult rejected(VenueType venue, String symbol, String errorCode, String message) {
        return OrderResult.builder()
                .venue(venue)
                .symbol(symbol)
                .success(false)
                .errorCode(errorCode)
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
