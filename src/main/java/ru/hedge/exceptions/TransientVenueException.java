package ru.hedge.exceptions;

import ru.hedge.dto.exchanges.VenueType;

/**
 * Network-level failure (timeout, dropped connection, 5xx). Safe to retry for reads.
 */
public class TransientVenueException extends VenueException {

    public TransientVenueException(VenueType venue, String message) {
        super(venue, "TRANSIENT", message);
    }

    public TransientVenueException(VenueType venue, String message, Throwable cause) {
        super(venue, "TRANSIENT", message, cause);
    }
}
