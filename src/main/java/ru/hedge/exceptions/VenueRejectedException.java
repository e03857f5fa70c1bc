package ru.hedge.exceptions;

import ru.hedge.dto.exchanges.VenueType;

public class VenueRejectedException extends VenueException {

    public VenueRejectedException(VenueType venue, String code, String message) {
        super(venue, code, message);
    }
}
