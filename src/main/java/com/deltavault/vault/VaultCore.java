package com.deltavault.vault;

import com.deltavault.asset.BaseAssetGateway;
import com.deltavault.domain.model.VaultSnapshot;
import com.deltavault.event.EventPublisherHelper;
import com.deltavault.exception.VaultException;
import com.deltavault.position.PositionManager;
import com.deltavault.position.RebalanceAmounts;
import com.deltavault.strategy.StrategyAdapter;
import com.deltavault.strategy.StrategyLeg;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accounting and allocation engine of the delta-neutral vault.
 *
 * <p>Depositors hand in base asset and receive shares; the capital is split between a
 * spot and a perp {@link StrategyAdapter}; withdrawals pull it back from both legs in
 * the ratio they hold it. A {@link PositionManager} measures delta and sizes rebalances.
 *
 * <p><b>Valuation:</b> {@link #totalAssets()} is the idle balance plus both strategies'
 * live balances, recomputed on every call. Share math truncates in the vault's favour on
 * both sides: a deposit never mints shares worth more than it brought in, a withdrawal
 * never pays more than the burned shares are worth.
 *
 * <p><b>Guards:</b> every mutating entry point takes the {@link ReentrancyGuard}, then
 * checks the pause flag, then validates its arguments. Each runs in a
 * {@link VaultUnitOfWork} so that any failure, including a collaborator that misreports
 * an amount, reverses every step already taken. Events are published only after the
 * lock is released and the operation has committed.
 *
 * <p><b>Administration:</b> collaborator handles, pause and ownership are owner-only.
 * Changes wait for the operation in flight, except the emergency pause, which lands at
 * once. Any of them called back from inside an operation fails with REENTRANT_CALL.
 */
@Service
public class VaultCore {

    private static final Logger log = LoggerFactory.getLogger(VaultCore.class);

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private final BaseAssetGateway baseAssetGateway;
    private final EventPublisherHelper eventPublisherHelper;
    private final BigInteger minDeposit;
    private final BigInteger precision;

    private final ShareLedger shareLedger = new ShareLedger();
    private final ReentrancyGuard reentrancyGuard = new ReentrancyGuard();

    private volatile String owner;
    private volatile boolean paused;
    private volatile BigInteger idleAssetBalance = BigInteger.ZERO;

    private volatile StrategyAdapter spotStrategy;
    private volatile StrategyAdapter perpStrategy;
    private volatile PositionManager positionManager;

    public VaultCore(
            VaultParameters vaultParameters,
            BaseAssetGateway baseAssetGateway,
            EventPublisherHelper eventPublisherHelper) {
        if (vaultParameters.getOwner() == null || vaultParameters.getOwner().isBlank()) {
            throw VaultException.zeroAddress("owner");
        }
        if (vaultParameters.getMinDeposit() == null || vaultParameters.getMinDeposit().signum() <= 0) {
            throw VaultException.zeroAmount("minDeposit");
        }
        if (vaultParameters.getPrecision() == null || vaultParameters.getPrecision().signum() <= 0) {
            throw VaultException.zeroAmount("precision");
        }
        this.owner = vaultParameters.getOwner();
        this.minDeposit = vaultParameters.getMinDeposit();
        this.precision = vaultParameters.getPrecision();
        this.baseAssetGateway = baseAssetGateway;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // VALUATION (read-only)
    // ========================

    /**
     * Idle balance plus both strategies' live balances. Degrades to the idle balance
     * alone while either strategy is unset.
     */
    public BigInteger totalAssets() {
        StrategyAdapter spot = spotStrategy;
        StrategyAdapter perp = perpStrategy;
        if (spot == null || perp == null) {
            return idleAssetBalance;
        }
        return idleAssetBalance.add(reportedAssets(spot)).add(reportedAssets(perp));
    }

    /**
     * Shares a deposit of {@code assets} would mint right now, rounded down.
     *
     * @throws VaultException ZERO_AMOUNT if {@code assets} is negative, or nonzero but too
     *                        small to mint a single share
     */
    public BigInteger previewDeposit(BigInteger assets) {
        requireNonNegative("assets", assets);
        BigInteger shares = calculateShares(assets);
        if (shares.signum() == 0 && assets.signum() > 0) {
            throw VaultException.zeroAmount("shares");
        }
        return shares;
    }

    /** Assets that burning {@code shares} would pay out right now, rounded down. */
    public BigInteger previewWithdraw(BigInteger shares) {
        requireNonNegative("shares", shares);
        BigInteger supply = shareLedger.totalSupply();
        if (supply.signum() == 0) {
            return BigInteger.ZERO;
        }
        return shares.multiply(totalAssets()).divide(supply);
    }

    public BigInteger getCurrentDelta() {
        PositionManager manager = positionManager;
        return manager == null ? BigInteger.ZERO : manager.getCurrentDelta();
    }

    public boolean isPaused() {
        return paused;
    }

    public BigInteger sharesOf(String account) {
        return shareLedger.balanceOf(account);
    }

    public BigInteger totalShares() {
        return shareLedger.totalSupply();
    }

    public BigInteger idleAssetBalance() {
        return idleAssetBalance;
    }

    public String getOwner() {
        return owner;
    }

    public StrategyAdapter getSpotStrategy() {
        return spotStrategy;
    }

    public StrategyAdapter getPerpStrategy() {
        return perpStrategy;
    }

    public PositionManager getPositionManager() {
        return positionManager;
    }

    public VaultSnapshot snapshot() {
        StrategyAdapter spot = spotStrategy;
        StrategyAdapter perp = perpStrategy;
        PositionManager manager = positionManager;
        return VaultSnapshot.builder()
                .owner(owner)
                .paused(paused)
                .idleAssets(idleAssetBalance)
                .spotAssets(spot != null ? reportedAssets(spot) : null)
                .perpAssets(perp != null ? reportedAssets(perp) : null)
                .totalAssets(totalAssets())
                .totalShares(shareLedger.totalSupply())
                .currentDelta(getCurrentDelta())
                .spotStrategy(spot != null ? spot.getName() : null)
                .perpStrategy(perp != null ? perp.getName() : null)
                .positionManager(manager != null ? manager.getName() : null)
                .build();
    }

    // ========================
    // DEPOSIT
    // ========================

    /**
     * Mints shares for {@code assets} pulled from {@code caller}, then deploys the assets
     * half to the spot leg and the rest (including any odd unit) to the perp leg.
     *
     * @return shares minted
     * @throws VaultException VAULT_PAUSED, ZERO_AMOUNT, DEPOSIT_TOO_SMALL, STRATEGY_NOT_SET,
     *                        STRATEGY_DEPOSIT_FAILED, or whatever the asset gateway raises
     */
    public BigInteger deposit(String caller, BigInteger assets) {
        BigInteger shares = reentrancyGuard.execute("deposit", () -> {
            requireNotPaused();
            requireAccount("caller", caller);
            requirePositive("assets", assets);
            if (assets.compareTo(minDeposit) < 0) {
                throw VaultException.depositTooSmall(assets, minDeposit);
            }
            StrategyAdapter spot = spotStrategy;
            StrategyAdapter perp = perpStrategy;
            if (spot == null || perp == null) {
                throw VaultException.strategyNotSet();
            }
            return VaultUnitOfWork.run("deposit", uow -> doDeposit(caller, assets, spot, perp, uow));
        });

        eventPublisherHelper.publishDeposit(this, caller, assets, shares);
        return shares;
    }

    private BigInteger doDeposit(
            String caller, BigInteger assets, StrategyAdapter spot, StrategyAdapter perp, VaultUnitOfWork uow) {
        // Priced against the valuation before this deposit's assets arrive
        BigInteger shares = calculateShares(assets);
        if (shares.signum() == 0) {
            throw VaultException.zeroAmount("shares");
        }

        baseAssetGateway.collect(caller, assets);
        uow.onRollback("refund " + assets + " to " + caller, () -> baseAssetGateway.release(caller, assets));
        creditIdle(assets);
        uow.onRollback("debit idle " + assets, () -> debitIdle(assets));

        shareLedger.mint(caller, shares);
        uow.onRollback("burn " + shares + " shares of " + caller, () -> shareLedger.burn(caller, shares));

        BigInteger spotAmount = assets.divide(TWO);
        BigInteger perpAmount = assets.subtract(spotAmount);
        deployToLeg(StrategyLeg.SPOT, spot, spotAmount, uow);
        deployToLeg(StrategyLeg.PERP, perp, perpAmount, uow);

        PositionManager manager = positionManager;
        if (manager != null) {
            manager.updatePosition(spotAmount, perpAmount);
        }

        log.info(
                "Deposit complete: owner={}, assets={}, shares={}, spot={}, perp={}",
                caller,
                assets,
                shares,
                spotAmount,
                perpAmount);
        return shares;
    }

    private BigInteger calculateShares(BigInteger assets) {
        BigInteger supply = shareLedger.totalSupply();
        BigInteger total = totalAssets();
        if (supply.signum() == 0 || total.signum() == 0) {
            return assets;
        }
        return assets.multiply(supply).divide(total);
    }

    private void deployToLeg(StrategyLeg leg, StrategyAdapter adapter, BigInteger amount, VaultUnitOfWork uow) {
        if (amount.signum() == 0) {
            return;
        }

        debitIdle(amount);
        uow.onRollback("credit idle " + amount + " back from " + leg, () -> creditIdle(amount));

        BigInteger accepted = adapter.deposit(amount);
        if (accepted != null && accepted.signum() > 0) {
            uow.onRollback(
                    "recall " + accepted + " from " + adapter.getName(), () -> recallFromLeg(adapter, accepted));
        }
        if (!amount.equals(accepted)) {
            throw VaultException.strategyDepositFailed(
                    adapter.getName(), amount, accepted != null ? accepted : BigInteger.ZERO);
        }
    }

    private void recallFromLeg(StrategyAdapter adapter, BigInteger amount) {
        BigInteger returned = adapter.withdraw(amount);
        if (!amount.equals(returned)) {
            throw VaultException.insufficientBalance(adapter.getName() + " recall", amount, nullToZero(returned));
        }
    }

    // ========================
    // WITHDRAW
    // ========================

    /**
     * Burns {@code shares} of {@code caller} and pays out their current value, pulling
     * the assets from each strategy in proportion to what it holds.
     *
     * @return assets paid to the caller
     * @throws VaultException VAULT_PAUSED, ZERO_AMOUNT, INSUFFICIENT_BALANCE
     */
    public BigInteger withdraw(String caller, BigInteger shares) {
        BigInteger assets = reentrancyGuard.execute("withdraw", () -> {
            requireNotPaused();
            requireAccount("caller", caller);
            requirePositive("shares", shares);
            BigInteger balance = shareLedger.balanceOf(caller);
            if (balance.compareTo(shares) < 0) {
                throw VaultException.insufficientBalance("shares", shares, balance);
            }
            return VaultUnitOfWork.run("withdraw", uow -> doWithdraw(caller, shares, uow));
        });

        eventPublisherHelper.publishWithdraw(this, caller, assets, shares);
        return assets;
    }

    private BigInteger doWithdraw(String caller, BigInteger shares, VaultUnitOfWork uow) {
        BigInteger assets = previewWithdraw(shares);
        if (assets.signum() == 0) {
            throw VaultException.zeroAmount("assets");
        }

        // Burn before any strategy sees control
        shareLedger.burn(caller, shares);
        uow.onRollback("re-mint " + shares + " shares to " + caller, () -> shareLedger.mint(caller, shares));

        // One reading of every balance; T is derived from it rather than re-queried
        List<LegBalance> legs = legBalances();
        BigInteger total = idleAssetBalance;
        for (LegBalance leg : legs) {
            total = total.add(leg.balance());
        }
        for (LegBalance leg : legs) {
            if (leg.balance().signum() == 0) {
                continue;
            }
            BigInteger legWithdraw = assets.multiply(leg.balance())
                    .multiply(precision)
                    .divide(total.multiply(precision));
            if (legWithdraw.signum() > 0) {
                pullFromLeg(leg, legWithdraw, uow);
            }
        }

        coverShortfall(assets, legs, uow);

        debitIdle(assets);
        uow.onRollback("credit idle " + assets + " back from payout", () -> creditIdle(assets));
        baseAssetGateway.release(caller, assets);

        log.info("Withdraw complete: owner={}, shares={}, assets={}", caller, shares, assets);
        return assets;
    }

    /**
     * Floor division per leg can leave the idle balance up to one unit per leg short of
     * the payout. Tops up from the leg holding the most.
     */
    private void coverShortfall(BigInteger assets, List<LegBalance> legs, VaultUnitOfWork uow) {
        BigInteger shortfall = assets.subtract(idleAssetBalance);
        if (shortfall.signum() <= 0) {
            return;
        }

        log.debug("Withdraw rounding shortfall of {}, topping up from strategies", shortfall);
        List<LegBalance> live = new ArrayList<>();
        for (LegBalance leg : legs) {
            live.add(new LegBalance(leg.leg(), leg.adapter(), reportedAssets(leg.adapter())));
        }
        live.sort(Comparator.comparing(LegBalance::balance).reversed());

        for (LegBalance leg : live) {
            if (shortfall.signum() == 0) {
                break;
            }
            BigInteger take = shortfall.min(leg.balance());
            if (take.signum() > 0) {
                pullFromLeg(leg, take, uow);
                shortfall = shortfall.subtract(take);
            }
        }

        if (shortfall.signum() > 0) {
            throw VaultException.insufficientBalance("idle assets", assets, idleAssetBalance);
        }
    }

    private void pullFromLeg(LegBalance leg, BigInteger amount, VaultUnitOfWork uow) {
        StrategyAdapter adapter = leg.adapter();
        BigInteger returned = nullToZero(adapter.withdraw(amount));
        if (returned.signum() > 0) {
            creditIdle(returned);
            uow.onRollback("redeploy " + returned + " to " + adapter.getName(), () -> {
                debitIdle(returned);
                BigInteger accepted = adapter.deposit(returned);
                if (!returned.equals(accepted)) {
                    throw VaultException.strategyDepositFailed(adapter.getName(), returned, nullToZero(accepted));
                }
            });
        }
        if (!amount.equals(returned)) {
            throw VaultException.insufficientBalance(leg.leg() + " strategy " + adapter.getName(), amount, returned);
        }
    }

    private List<LegBalance> legBalances() {
        StrategyAdapter spot = spotStrategy;
        StrategyAdapter perp = perpStrategy;
        if (spot == null || perp == null) {
            // Unset legs are outside the valuation, so they are outside the payout too
            return List.of();
        }
        return List.of(
                new LegBalance(StrategyLeg.SPOT, spot, reportedAssets(spot)),
                new LegBalance(StrategyLeg.PERP, perp, reportedAssets(perp)));
    }

    private record LegBalance(StrategyLeg leg, StrategyAdapter adapter, BigInteger balance) {}

    // ========================
    // SHARE TRANSFER
    // ========================

    /**
     * Moves shares between holders. Not gated by pause: holders can always reassign
     * their claims.
     */
    public void transferShares(String caller, String to, BigInteger shares) {
        reentrancyGuard.run("transferShares", () -> {
            requireAccount("caller", caller);
            requireAccount("to", to);
            requirePositive("shares", shares);
            shareLedger.transfer(caller, to, shares);
        });

        log.info("Shares transferred: from={}, to={}, shares={}", caller, to, shares);
        eventPublisherHelper.publishSharesTransferred(this, caller, to, shares);
    }

    // ========================
    // REBALANCE
    // ========================

    /**
     * Asks the position manager for rebalance sizing and records delta before and after.
     *
     * <p>The sizing is logged and carried on the REBALANCE event but no capital is moved
     * for it: the position manager contract does not define transfer semantics for the
     * adjustments, so applying them is left to the manager.
     *
     * @throws VaultException VAULT_PAUSED, POSITION_MANAGER_NOT_SET, REBALANCE_NOT_NEEDED
     */
    public void rebalance() {
        RebalanceOutcome outcome = reentrancyGuard.execute("rebalance", () -> {
            requireNotPaused();
            PositionManager manager = positionManager;
            if (manager == null) {
                throw VaultException.positionManagerNotSet();
            }
            if (!manager.isRebalanceNeeded()) {
                throw VaultException.rebalanceNotNeeded();
            }

            BigInteger oldDelta = nullToZero(manager.getCurrentDelta());
            RebalanceAmounts sizing = manager.calculateRebalanceAmounts();
            if (sizing == null) {
                sizing = RebalanceAmounts.NONE;
            }
            log.info(
                    "Rebalance sizing from {}: spotAdjustment={}, perpAdjustment={}",
                    manager.getName(),
                    sizing.spotAdjustment(),
                    sizing.perpAdjustment());
            BigInteger newDelta = nullToZero(manager.getCurrentDelta());
            return new RebalanceOutcome(oldDelta, newDelta, sizing);
        });

        log.info("Rebalance complete: oldDelta={}, newDelta={}", outcome.oldDelta(), outcome.newDelta());
        eventPublisherHelper.publishRebalance(this, outcome.oldDelta(), outcome.newDelta(), outcome.sizing());
    }

    private record RebalanceOutcome(BigInteger oldDelta, BigInteger newDelta, RebalanceAmounts sizing) {}

    // ========================
    // ADMINISTRATION
    // ========================

    public void setSpotStrategy(String caller, StrategyAdapter adapter) {
        setStrategy(caller, StrategyLeg.SPOT, adapter);
    }

    public void setPerpStrategy(String caller, StrategyAdapter adapter) {
        setStrategy(caller, StrategyLeg.PERP, adapter);
    }

    private void setStrategy(String caller, StrategyLeg leg, StrategyAdapter adapter) {
        requireOwner(caller);
        if (adapter == null) {
            throw VaultException.zeroAddress("strategy");
        }
        reentrancyGuard.run("set" + (leg == StrategyLeg.SPOT ? "Spot" : "Perp") + "Strategy", () -> {
            if (leg == StrategyLeg.SPOT) {
                spotStrategy = adapter;
            } else {
                perpStrategy = adapter;
            }
        });
        log.info("{} strategy set to {} by {}", leg, adapter.getName(), caller);
        eventPublisherHelper.publishStrategyUpdated(this, leg, adapter.getName());
    }

    public void setPositionManager(String caller, PositionManager manager) {
        requireOwner(caller);
        if (manager == null) {
            throw VaultException.zeroAddress("positionManager");
        }
        reentrancyGuard.run("setPositionManager", () -> positionManager = manager);
        log.info("Position manager set to {} by {}", manager.getName(), caller);
        eventPublisherHelper.publishPositionManagerUpdated(this, manager.getName());
    }

    public void emergencyPause(String caller) {
        setPaused(caller, true);
    }

    public void emergencyUnpause(String caller) {
        setPaused(caller, false);
    }

    /**
     * Pausing never waits for the operation in flight: it stops the next one at its pause
     * check. Unpausing queues on the lock like any other mutation.
     */
    private void setPaused(String caller, boolean value) {
        requireOwner(caller);
        if (value) {
            reentrancyGuard.requireNotReentered("emergencyPause");
            paused = true;
            log.warn("VAULT PAUSED by {}", caller);
        } else {
            reentrancyGuard.run("emergencyUnpause", () -> paused = false);
            log.info("Vault unpaused by {}", caller);
        }
        eventPublisherHelper.publishEmergencyPause(this, value);
    }

    public void transferOwnership(String caller, String newOwner) {
        requireOwner(caller);
        requireAccount("newOwner", newOwner);
        String previousOwner = reentrancyGuard.execute("transferOwnership", () -> {
            String replaced = owner;
            owner = newOwner;
            return replaced;
        });
        log.info("Ownership transferred from {} to {}", previousOwner, newOwner);
        eventPublisherHelper.publishOwnershipTransferred(this, previousOwner, newOwner);
    }

    // ========================
    // INTERNALS
    // ========================

    private void creditIdle(BigInteger amount) {
        idleAssetBalance = idleAssetBalance.add(amount);
    }

    private void debitIdle(BigInteger amount) {
        if (idleAssetBalance.compareTo(amount) < 0) {
            throw VaultException.insufficientBalance("idle assets", amount, idleAssetBalance);
        }
        idleAssetBalance = idleAssetBalance.subtract(amount);
    }

    private BigInteger reportedAssets(StrategyAdapter adapter) {
        return nullToZero(adapter.totalAssets());
    }

    private void requireNotPaused() {
        if (paused) {
            throw VaultException.vaultPaused();
        }
    }

    private void requireOwner(String caller) {
        if (caller == null || !caller.equals(owner)) {
            throw VaultException.notOwner(caller);
        }
    }

    private static void requireAccount(String argument, String account) {
        if (account == null || account.isBlank()) {
            throw VaultException.zeroAddress(argument);
        }
    }

    private static void requirePositive(String argument, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw VaultException.zeroAmount(argument);
        }
    }

    private static void requireNonNegative(String argument, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw VaultException.zeroAmount(argument);
        }
    }

    private static BigInteger nullToZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
