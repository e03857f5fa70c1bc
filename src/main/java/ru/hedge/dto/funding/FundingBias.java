package ru.hedge.dto.funding;

public enum FundingBias {
    NONE,      // below the meaningful floor
    SMALL,     // < 0.01%, near random
    MODERATE,  // 0.01% - 0.05%, mild bias
    LARGE      // > 0.05%, strong bias
}
