package com.deltavault.simulator;

import com.deltavault.vault.VaultCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Installs the simulated legs and position manager on the vault once the application is
 * ready, acting as the configured owner through the regular owner-only setters.
 */
@Component
@ConditionalOnProperty(prefix = "deltavault.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatorBootstrap implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(SimulatorBootstrap.class);

    private final VaultCore vaultCore;
    private final SimulatedStrategyAdapter spotStrategyAdapter;
    private final SimulatedStrategyAdapter perpStrategyAdapter;
    private final SimulatedPositionManager simulatedPositionManager;

    public SimulatorBootstrap(
            VaultCore vaultCore,
            @Qualifier("spotStrategyAdapter") SimulatedStrategyAdapter spotStrategyAdapter,
            @Qualifier("perpStrategyAdapter") SimulatedStrategyAdapter perpStrategyAdapter,
            SimulatedPositionManager simulatedPositionManager) {
        this.vaultCore = vaultCore;
        this.spotStrategyAdapter = spotStrategyAdapter;
        this.perpStrategyAdapter = perpStrategyAdapter;
        this.simulatedPositionManager = simulatedPositionManager;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        String owner = vaultCore.getOwner();
        vaultCore.setSpotStrategy(owner, spotStrategyAdapter);
        vaultCore.setPerpStrategy(owner, perpStrategyAdapter);
        vaultCore.setPositionManager(owner, simulatedPositionManager);
        log.info(
                "Simulator installed: spot={}, perp={}, positionManager={}",
                spotStrategyAdapter.getName(),
                perpStrategyAdapter.getName(),
                simulatedPositionManager.getName());
    }
}
