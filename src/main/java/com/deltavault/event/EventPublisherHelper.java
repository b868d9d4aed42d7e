package com.deltavault.event;

import com.deltavault.position.RebalanceAmounts;
import com.deltavault.strategy.StrategyLeg;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for every
 * {@link VaultEventType}. Call sites read as {@code publishDeposit(this, owner, assets, shares)}
 * instead of hand-assembling detail maps.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Share flow ----

    public void publishDeposit(Object source, String owner, BigInteger assets, BigInteger shares) {
        publish(source, VaultEventType.DEPOSIT, ownerAssetsShares(owner, assets, shares));
    }

    public void publishWithdraw(Object source, String owner, BigInteger assets, BigInteger shares) {
        publish(source, VaultEventType.WITHDRAW, ownerAssetsShares(owner, assets, shares));
    }

    public void publishSharesTransferred(Object source, String from, String to, BigInteger shares) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", from);
        details.put("to", to);
        details.put("shares", shares);
        publish(source, VaultEventType.SHARES_TRANSFERRED, details);
    }

    // ---- Rebalance ----

    public void publishRebalance(Object source, BigInteger oldDelta, BigInteger newDelta, RebalanceAmounts sizing) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("oldDelta", oldDelta);
        details.put("newDelta", newDelta);
        details.put("spotAdjustment", sizing.spotAdjustment());
        details.put("perpAdjustment", sizing.perpAdjustment());
        publish(source, VaultEventType.REBALANCE, details);
    }

    // ---- Administration ----

    public void publishEmergencyPause(Object source, boolean paused) {
        publish(source, VaultEventType.EMERGENCY_PAUSE, Map.of("paused", paused));
    }

    public void publishStrategyUpdated(Object source, StrategyLeg leg, String strategyName) {
        publish(source, VaultEventType.STRATEGY_UPDATED, Map.of("leg", leg, "strategy", strategyName));
    }

    public void publishPositionManagerUpdated(Object source, String positionManagerName) {
        publish(source, VaultEventType.POSITION_MANAGER_UPDATED, Map.of("positionManager", positionManagerName));
    }

    public void publishOwnershipTransferred(Object source, String previousOwner, String newOwner) {
        publish(source, VaultEventType.OWNERSHIP_TRANSFERRED,
                Map.of("previousOwner", previousOwner, "newOwner", newOwner));
    }

    private void publish(Object source, VaultEventType eventType, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new VaultEvent(source, eventType, details));
    }

    private static Map<String, Object> ownerAssetsShares(String owner, BigInteger assets, BigInteger shares) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("owner", owner);
        details.put("assets", assets);
        details.put("shares", shares);
        return details;
    }
}
