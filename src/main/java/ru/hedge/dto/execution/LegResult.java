package ru.hedge.dto.execution;

import lombok.Builder;
import lombok.Value;
import ru.hedge.dto.exchanges.Direction;
import ru.hedge.dto.exchanges.OrderResult;
import ru.hedge.dto.exchanges.VenueType;

/**
 * Outcome of one venue's side of an atomic action. Side is null for close legs.
 */
@Value
@Builder
public class LegResult {
    VenueType venue;
    Direction side;
    boolean success;
    OrderResult orderResult;
    LegErrorType errorType;
    String errorMessage;

    public static LegResult of(VenueType venue, Direction side, OrderResult result) {
        if (result == null) {
            return failed(venue, side, LegErrorType.UNEXPECTED_EXCEPTION, "Venue returned no result");
        }
        return LegResult.builder()
                .venue(venue)
                .side(side)
                .success(result.isSuccess())
                .orderResult(result)
                .errorType(result.isSuccess() ? null : LegErrorType.EXCHANGE_REJECTED)
                .errorMessage(result.isSuccess() ? null : result.getMessage())
                .build();
    }

    public static LegResult failed(VenueType venue, Direction side, LegErrorType type, String message) {
        return LegResult.builder()
                .venue(venue)
                .side(side)
                .success(false)
                .errorType(type)
                .errorMessage(message)
                .build();
    }

    public double getFilledQuantity() {
        return orderResult == null ? 0.0 : orderResult.getFilledQuantity();
    }
}
