package com.deltavault.config;

import com.deltavault.simulator.SimulatedPositionManager;
import com.deltavault.simulator.SimulatedStrategyAdapter;
import com.deltavault.vault.VaultParameters;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Simulated spot/perp legs and position manager for running the vault without live
 * protocols. The handles are installed on the vault by SimulatorBootstrap once the
 * application is ready.
 *
 * <p>Properties prefix: {@code deltavault.simulator.*}.
 */
@Configuration
@ConditionalOnProperty(prefix = "deltavault.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatorConfig {

    @Bean
    public SimulatedStrategyAdapter spotStrategyAdapter(
            @Value("${deltavault.simulator.spot-name:sim-spot}") String name) {
        return new SimulatedStrategyAdapter(name);
    }

    @Bean
    public SimulatedStrategyAdapter perpStrategyAdapter(
            @Value("${deltavault.simulator.perp-name:sim-perp}") String name) {
        return new SimulatedStrategyAdapter(name);
    }

    @Bean
    public SimulatedPositionManager simulatedPositionManager(
            @Value("${deltavault.simulator.position-manager-name:sim-delta}") String name,
            @Qualifier("spotStrategyAdapter") SimulatedStrategyAdapter spotStrategyAdapter,
            @Qualifier("perpStrategyAdapter") SimulatedStrategyAdapter perpStrategyAdapter,
            VaultParameters vaultParameters) {
        return new SimulatedPositionManager(
                name, spotStrategyAdapter, perpStrategyAdapter, vaultParameters.getMaxDeltaToleranceBps());
    }
}
