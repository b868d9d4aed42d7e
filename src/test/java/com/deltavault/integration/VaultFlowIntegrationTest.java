package com.deltavault.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.deltavault.asset.InMemoryBaseAssetGateway;
import com.deltavault.event.EventPublisherHelper;
import com.deltavault.event.VaultEvent;
import com.deltavault.event.VaultEventType;
import com.deltavault.exception.ErrorCode;
import com.deltavault.exception.VaultException;
import com.deltavault.observability.VaultMetricsService;
import com.deltavault.simulator.SimulatedPositionManager;
import com.deltavault.simulator.SimulatedStrategyAdapter;
import com.deltavault.simulator.SimulatorBootstrap;
import com.deltavault.vault.VaultCore;
import com.deltavault.vault.VaultParameters;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.event.ApplicationReadyEvent;

/**
 * End-to-end vault flow with real collaborators: VaultCore, the in-memory base asset,
 * simulated legs and position manager installed by SimulatorBootstrap, and events routed
 * through EventPublisherHelper into VaultMetricsService.
 *
 * <p>Walks deposit -> second deposit -> yield -> rebalance -> withdraw -> pause -> unpause
 * and checks balances, events and metrics at each step.
 */
class VaultFlowIntegrationTest {

    private static final String OWNER = "vault-admin";

    private final List<VaultEvent> events = new ArrayList<>();

    private SimpleMeterRegistry meterRegistry;
    private InMemoryBaseAssetGateway gateway;
    private SimulatedStrategyAdapter spot;
    private SimulatedStrategyAdapter perp;
    private SimulatedPositionManager positionManager;
    private VaultCore vaultCore;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gateway = new InMemoryBaseAssetGateway();
        gateway.fund("alice", BigInteger.valueOf(1_000));
        gateway.fund("bob", BigInteger.valueOf(1_000));

        VaultParameters parameters = VaultParameters.builder()
                .owner(OWNER)
                .minDeposit(BigInteger.TEN)
                .precision(BigInteger.TEN.pow(18))
                .maxDeltaToleranceBps(200)
                .build();

        VaultMetricsService[] metrics = new VaultMetricsService[1];
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(event -> {
            VaultEvent vaultEvent = (VaultEvent) event;
            events.add(vaultEvent);
            metrics[0].onVaultEvent(vaultEvent);
        });
        vaultCore = new VaultCore(parameters, gateway, eventPublisherHelper);
        metrics[0] = new VaultMetricsService(meterRegistry, vaultCore);

        spot = new SimulatedStrategyAdapter("sim-spot");
        perp = new SimulatedStrategyAdapter("sim-perp");
        positionManager = new SimulatedPositionManager("sim-delta", spot, perp, parameters.getMaxDeltaToleranceBps());
        new SimulatorBootstrap(vaultCore, spot, perp, positionManager)
                .onApplicationEvent(mock(ApplicationReadyEvent.class));
    }

    private List<VaultEventType> eventTypes() {
        return events.stream().map(VaultEvent::getEventType).toList();
    }

    @Test
    @DisplayName("Bootstrap installs the simulated collaborators as the owner")
    void bootstrapInstallsCollaborators() {
        assertThat(vaultCore.getSpotStrategy()).isSameAs(spot);
        assertThat(vaultCore.getPerpStrategy()).isSameAs(perp);
        assertThat(vaultCore.getPositionManager()).isSameAs(positionManager);
        assertThat(eventTypes())
                .containsExactly(
                        VaultEventType.STRATEGY_UPDATED,
                        VaultEventType.STRATEGY_UPDATED,
                        VaultEventType.POSITION_MANAGER_UPDATED);
    }

    @Test
    @DisplayName("Full lifecycle: deposits, yield, rebalance, withdraw, pause")
    void fullLifecycle() {
        events.clear();

        assertThat(vaultCore.deposit("alice", BigInteger.valueOf(100))).isEqualTo(BigInteger.valueOf(100));
        assertThat(vaultCore.deposit("bob", BigInteger.valueOf(50))).isEqualTo(BigInteger.valueOf(50));
        assertThat(positionManager.getLastSpotAllocation()).isEqualTo(BigInteger.valueOf(25));
        assertThat(vaultCore.getCurrentDelta()).isZero();

        spot.accrueYield(BigInteger.valueOf(15));
        assertThat(vaultCore.totalAssets()).isEqualTo(BigInteger.valueOf(165));
        assertThat(vaultCore.getCurrentDelta()).isEqualTo(BigInteger.valueOf(15));

        // |15| of 165 deployed is beyond 2%
        vaultCore.rebalance();
        VaultEvent rebalance = events.get(events.size() - 1);
        assertThat(rebalance.getEventType()).isEqualTo(VaultEventType.REBALANCE);
        assertThat(rebalance.detail("oldDelta", BigInteger.class)).isEqualTo(BigInteger.valueOf(15));
        assertThat(rebalance.detail("spotAdjustment", BigInteger.class)).isEqualTo(BigInteger.valueOf(-7));
        assertThat(rebalance.detail("perpAdjustment", BigInteger.class)).isEqualTo(BigInteger.valueOf(7));

        assertThat(vaultCore.withdraw("bob", BigInteger.valueOf(50))).isEqualTo(BigInteger.valueOf(55));
        assertThat(gateway.balanceOf("bob")).isEqualTo(BigInteger.valueOf(1_005));

        vaultCore.emergencyPause(OWNER);
        assertThatThrownBy(() -> vaultCore.withdraw("alice", BigInteger.valueOf(100)))
                .isInstanceOf(VaultException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.VAULT_PAUSED);
        vaultCore.emergencyUnpause(OWNER);

        assertThat(vaultCore.withdraw("alice", BigInteger.valueOf(100))).isEqualTo(BigInteger.valueOf(110));
        assertThat(vaultCore.totalShares()).isZero();
        assertThat(vaultCore.totalAssets()).isZero();
        assertThat(gateway.balanceOf("alice")).isEqualTo(BigInteger.valueOf(1_010));

        assertThat(eventTypes())
                .containsExactly(
                        VaultEventType.DEPOSIT,
                        VaultEventType.DEPOSIT,
                        VaultEventType.REBALANCE,
                        VaultEventType.WITHDRAW,
                        VaultEventType.EMERGENCY_PAUSE,
                        VaultEventType.EMERGENCY_PAUSE,
                        VaultEventType.WITHDRAW);

        assertThat(meterRegistry.get("vault.deposits.count").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("vault.withdrawn.assets").counter().count()).isEqualTo(165.0);
        assertThat(meterRegistry.get("vault.rebalances.count").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("vault.pause.toggles").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Rebalance inside tolerance is refused and publishes nothing")
    void rebalanceInsideTolerance() {
        vaultCore.deposit("alice", BigInteger.valueOf(100));
        events.clear();

        assertThatThrownBy(() -> vaultCore.rebalance())
                .isInstanceOf(VaultException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.REBALANCE_NOT_NEEDED);
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("Failed withdrawal publishes nothing and leaves metrics untouched")
    void failedWithdrawalNotCounted() {
        vaultCore.deposit("alice", BigInteger.valueOf(100));
        events.clear();

        assertThatThrownBy(() -> vaultCore.withdraw("bob", BigInteger.ONE))
                .isInstanceOf(VaultException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);

        assertThat(events).isEmpty();
        assertThat(meterRegistry.get("vault.withdrawals.count").counter().count()).isZero();
        assertThat(meterRegistry.get("vault.total.assets").gauge().value()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Loss on one leg is shared by every holder")
    void lossShared() {
        vaultCore.deposit("alice", BigInteger.valueOf(100));
        vaultCore.deposit("bob", BigInteger.valueOf(100));
        perp.realizeLoss(BigInteger.valueOf(40));

        assertThat(vaultCore.previewWithdraw(vaultCore.sharesOf("alice"))).isEqualTo(BigInteger.valueOf(80));
        assertThat(vaultCore.withdraw("bob", BigInteger.valueOf(100))).isEqualTo(BigInteger.valueOf(80));
        assertThat(vaultCore.totalAssets()).isEqualTo(BigInteger.valueOf(80));
    }
}
