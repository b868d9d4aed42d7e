package com.deltavault.observability;

import com.deltavault.event.VaultEvent;
import com.deltavault.vault.VaultCore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigInteger;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the vault.
 * <ul>
 *   <li><b>vault.deposits.count</b> / <b>vault.withdrawals.count</b> /
 *       <b>vault.rebalances.count</b> / <b>vault.pause.toggles</b> (counters): incremented from
 *       {@link VaultEvent}s, so only committed operations are counted</li>
 *   <li><b>vault.deposited.assets</b> / <b>vault.withdrawn.assets</b> (counters): base-asset
 *       units moved</li>
 *   <li><b>vault.total.assets</b>, <b>vault.total.shares</b>, <b>vault.paused</b> (gauges):
 *       polled from {@link VaultCore} at scrape time</li>
 * </ul>
 */
@Service
public class VaultMetricsService {

    private final Counter depositsCounter;
    private final Counter withdrawalsCounter;
    private final Counter rebalancesCounter;
    private final Counter pauseTogglesCounter;
    private final Counter depositedAssetsCounter;
    private final Counter withdrawnAssetsCounter;

    public VaultMetricsService(MeterRegistry meterRegistry, VaultCore vaultCore) {
        this.depositsCounter = Counter.builder("vault.deposits.count")
                .description("Committed deposits")
                .register(meterRegistry);
        this.withdrawalsCounter = Counter.builder("vault.withdrawals.count")
                .description("Committed withdrawals")
                .register(meterRegistry);
        this.rebalancesCounter = Counter.builder("vault.rebalances.count")
                .description("Rebalances requested from the position manager")
                .register(meterRegistry);
        this.pauseTogglesCounter = Counter.builder("vault.pause.toggles")
                .description("Emergency pause and unpause calls")
                .register(meterRegistry);
        this.depositedAssetsCounter = Counter.builder("vault.deposited.assets")
                .description("Base-asset units deposited")
                .register(meterRegistry);
        this.withdrawnAssetsCounter = Counter.builder("vault.withdrawn.assets")
                .description("Base-asset units paid out")
                .register(meterRegistry);

        meterRegistry.gauge("vault.total.assets", vaultCore, core -> core.totalAssets().doubleValue());
        meterRegistry.gauge("vault.total.shares", vaultCore, core -> core.totalShares().doubleValue());
        meterRegistry.gauge("vault.paused", vaultCore, core -> core.isPaused() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onVaultEvent(VaultEvent event) {
        switch (event.getEventType()) {
            case DEPOSIT -> {
                depositsCounter.increment();
                depositedAssetsCounter.increment(assetsOf(event));
            }
            case WITHDRAW -> {
                withdrawalsCounter.increment();
                withdrawnAssetsCounter.increment(assetsOf(event));
            }
            case REBALANCE -> rebalancesCounter.increment();
            case EMERGENCY_PAUSE -> pauseTogglesCounter.increment();
            default -> {
                // administrative events are not metered
            }
        }
    }

    private static double assetsOf(VaultEvent event) {
        BigInteger assets = event.detail("assets", BigInteger.class);
        return assets != null ? assets.doubleValue() : 0.0;
    }
}
