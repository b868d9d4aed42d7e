package com.deltavault.config;

import com.deltavault.asset.InMemoryBaseAssetGateway;
import com.deltavault.position.PositionManager;
import com.deltavault.strategy.CollaboratorRegistry;
import com.deltavault.strategy.StrategyAdapter;
import com.deltavault.vault.VaultParameters;
import java.math.BigInteger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the vault's construction parameters and base-asset gateway from
 * application.properties.
 *
 * <p>Properties prefix: {@code deltavault.vault.*}. Amounts are base-asset units; the
 * defaults suit a 6-decimal stablecoin (1 unit minimum deposit, 18-digit precision
 * scale, 2% delta tolerance).
 */
@Configuration
public class VaultConfig {

    @Bean
    public VaultParameters vaultParameters(
            @Value("${deltavault.vault.owner}") String owner,
            @Value("${deltavault.vault.min-deposit:1000000}") BigInteger minDeposit,
            @Value("${deltavault.vault.precision:1000000000000000000}") BigInteger precision,
            @Value("${deltavault.vault.max-delta-tolerance-bps:200}") int maxDeltaToleranceBps) {
        return VaultParameters.builder()
                .owner(owner)
                .minDeposit(minDeposit)
                .precision(precision)
                .maxDeltaToleranceBps(maxDeltaToleranceBps)
                .build();
    }

    /**
     * In-memory ledger until a token-backed gateway exists; it is the only
     * {@link com.deltavault.asset.BaseAssetGateway} implementation shipped.
     */
    @Bean
    public InMemoryBaseAssetGateway baseAssetGateway() {
        return new InMemoryBaseAssetGateway();
    }

    @Bean
    public CollaboratorRegistry collaboratorRegistry(
            ObjectProvider<StrategyAdapter> strategyAdapters, ObjectProvider<PositionManager> positionManagers) {
        return new CollaboratorRegistry(
                strategyAdapters.orderedStream().toList(),
                positionManagers.orderedStream().toList());
    }
}
