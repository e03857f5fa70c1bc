package ru.hedge.dto.exchanges;

public enum VenueType {
    EXTENDED("Extended"),
    TRADEXYZ("TradeXYZ");

    private final String displayName;

    VenueType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
