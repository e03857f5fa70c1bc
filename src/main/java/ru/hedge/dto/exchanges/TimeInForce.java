package ru.hedge.dto.exchanges;

public enum TimeInForce {
    GTC, // Good Till Cancel
    GTT, // Good Till Time
    IOC, // Immediate or Cancel
    FOK  // Fill or Kill
}
