package ru.hedge.service;

import org.junit.jupiter.api.Test;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.Position;
import ru.hedge.dto.funding.CyclePnl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PnlCalculatorTest {

    private final PnlCalculator calculator = new PnlCalculator(new HedgeConfig());

    @Test
    void simpleEstimateChargesFourTrades() {
        CyclePnl pnl = calculator.calculateSimple(10_000, 0, 0, 3.0, -1.0);

        assertThat(pnl.getTotalFees()).isCloseTo(20.0, within(1e-9));
        assertThat(pnl.getTotalFunding()).isCloseTo(2.0, within(1e-9));
        assertThat(pnl.getNetPnl()).isCloseTo(-18.0, within(1e-9));
    }

    @Test
    void snapshotDifferenceIgnoresHistoryBeforeOpen() {
        Position firstOpen = Position.builder().realizedPnl(100).fundingAccumulated(5).build();
        Position firstClose = Position.builder().realizedPnl(130).fundingAccumulated(8).build();
        Position secondClose = Position.builder().realizedPnl(-20).fundingAccumulated(-1).build();

        CyclePnl pnl = calculator.calculateFromSnapshots(firstOpen, firstClose, null, secondClose, 2, 3);

        assertThat(pnl.getFirstRealizedPnl()).isCloseTo(30, within(1e-9));
        assertThat(pnl.getSecondRealizedPnl()).isCloseTo(-20, within(1e-9));
        assertThat(pnl.getTotalFunding()).isCloseTo(2, within(1e-9));
        assertThat(pnl.getGrossPnl()).isCloseTo(12, within(1e-9));
        assertThat(pnl.getNetPnl()).isCloseTo(7, within(1e-9));
    }

    @Test
    void missingCloseSnapshotCountsAsZero() {
        Position open = Position.builder().realizedPnl(100).build();

        CyclePnl pnl = calculator.calculateFromSnapshots(open, null, open, null, 0, 0);

        assertThat(pnl.getNetPnl()).isZero();
    }
}
