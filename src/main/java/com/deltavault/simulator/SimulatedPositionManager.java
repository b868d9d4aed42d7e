package com.deltavault.simulator;

import com.deltavault.position.PositionManager;
import com.deltavault.position.RebalanceAmounts;
import com.deltavault.strategy.StrategyAdapter;
import java.math.BigInteger;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Position manager for the simulator. Treats the spot leg's assets as long exposure and
 * the perp leg's assets as the notional of an equal short hedge, so
 * {@code delta = spot - perp}.
 *
 * <p>A rebalance is needed once {@code |delta|} exceeds {@code maxDeltaToleranceBps} of
 * the capital deployed across both legs. Sizing moves half of the imbalance from the
 * heavy leg to the light one.
 */
public class SimulatedPositionManager implements PositionManager {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPositionManager.class);

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);
    private static final BigInteger TWO = BigInteger.valueOf(2);

    private final String name;
    private final StrategyAdapter spotLeg;
    private final StrategyAdapter perpLeg;
    private final BigInteger maxDeltaToleranceBps;

    @Getter
    private volatile BigInteger lastSpotAllocation = BigInteger.ZERO;

    @Getter
    private volatile BigInteger lastPerpAllocation = BigInteger.ZERO;

    public SimulatedPositionManager(
            String name, StrategyAdapter spotLeg, StrategyAdapter perpLeg, int maxDeltaToleranceBps) {
        this.name = name;
        this.spotLeg = spotLeg;
        this.perpLeg = perpLeg;
        this.maxDeltaToleranceBps = BigInteger.valueOf(maxDeltaToleranceBps);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isRebalanceNeeded() {
        BigInteger deployed = spotLeg.totalAssets().add(perpLeg.totalAssets());
        if (deployed.signum() == 0) {
            return false;
        }
        // |delta| / deployed > tolerance / 10000, kept in integers
        BigInteger scaledDelta = getCurrentDelta().abs().multiply(BPS_DENOMINATOR);
        return scaledDelta.compareTo(maxDeltaToleranceBps.multiply(deployed)) > 0;
    }

    @Override
    public BigInteger getCurrentDelta() {
        return spotLeg.totalAssets().subtract(perpLeg.totalAssets());
    }

    @Override
    public RebalanceAmounts calculateRebalanceAmounts() {
        BigInteger half = getCurrentDelta().divide(TWO);
        return new RebalanceAmounts(half.negate(), half);
    }

    @Override
    public void updatePosition(BigInteger spotAmount, BigInteger perpAmount) {
        lastSpotAllocation = spotAmount;
        lastPerpAllocation = perpAmount;
        log.debug("{}: deposit split spot={}, perp={}, delta={}", name, spotAmount, perpAmount, getCurrentDelta());
    }
}
