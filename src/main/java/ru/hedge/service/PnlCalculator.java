package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.Position;
import ru.hedge.dto.funding.CyclePnl;

import java.util.function.ToDoubleFunction;

/**
 * Estimated cycle P&L. Not reconciled against venue ledgers.
 */
@Slf4j
@Service
public class PnlCalculator {

    //2 venues x (open + close)
    private static final int TRADES_PER_CYCLE = 4;

    private final double feeRate;

    public PnlCalculator(HedgeConfig config) {
        this.feeRate = config.getPnl().getFeeRate();
    }

    public CyclePnl calculateSimple(double positionValue, double firstRealized, double secondRealized,
                                    double firstFunding, double secondFunding) {
        double fees = positionValue * feeRate * TRADES_PER_CYCLE;
        double net = firstRealized + secondRealized + firstFunding + secondFunding - fees;

        return CyclePnl.builder()
                .firstRealizedPnl(firstRealized)
                .secondRealizedPnl(secondRealized)
                .firstFunding(firstFunding)
                .secondFunding(secondFunding)
                .totalFees(fees)
                .netPnl(net)
                .build();
    }

    /**
     * Difference between the position snapshots taken at open and at close. Missing snapshots count as zero.
     */
    public CyclePnl calculateFromSnapshots(Position firstOpen, Position firstClose,
                                           Position secondOpen, Position secondClose,
                                           double openFees, double closeFees) {
        double firstRealized = delta(firstOpen, firstClose, Position::getRealizedPnl);
        double secondRealized = delta(secondOpen, secondClose, Position::getRealizedPnl);
        double firstFunding = delta(firstOpen, firstClose, Position::getFundingAccumulated);
        double secondFunding = delta(secondOpen, secondClose, Position::getFundingAccumulated);
        double fees = openFees + closeFees;

        CyclePnl pnl = CyclePnl.builder()
                .firstRealizedPnl(firstRealized)
                .secondRealizedPnl(secondRealized)
                .firstFunding(firstFunding)
                .secondFunding(secondFunding)
                .totalFees(fees)
                .netPnl(firstRealized + secondRealized + firstFunding + secondFunding - fees)
                .build();

        log.debug("[PnL] gross={} fees={} net={}", pnl.getGrossPnl(), fees, pnl.getNetPnl());
        return pnl;
    }

    private static double delta(Position open, Position close, ToDoubleFunction<Position> field) {
        if (close == null) {
            return 0.0;
        }
        return open == null ? field.applyAsDouble(close) : field.applyAsDouble(close) - field.applyAsDouble(open);
    }
}
