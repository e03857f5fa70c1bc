package ru.hedge.exceptions;

import lombok.Getter;
import ru.hedge.dto.exchanges.VenueType;

@Getter
public class VenueException extends RuntimeException {

    private final VenueType venue;
    private final String code;

    public VenueException(VenueType venue, String code, String message) {
        super(message);
        this.venue = venue;
        this.code = code;
    }

    public VenueException(VenueType venue, String code, String message, Throwable cause) {
        super(message, cause);
        this.venue = venue;
        this.code = code;
    }
}
