package com.deltavault.strategy;

import com.deltavault.exception.ResourceNotFoundException;
import com.deltavault.exception.VaultException;
import com.deltavault.position.PositionManager;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Name lookup of every strategy adapter and position manager known to the application,
 * used by the admin API to resolve the handle an owner wants to install.
 */
public class CollaboratorRegistry {

    private final Map<String, StrategyAdapter> strategies;
    private final Map<String, PositionManager> positionManagers;

    public CollaboratorRegistry(List<StrategyAdapter> strategies, List<PositionManager> positionManagers) {
        this.strategies = strategies.stream()
                .collect(Collectors.toUnmodifiableMap(StrategyAdapter::getName, Function.identity()));
        this.positionManagers = positionManagers.stream()
                .collect(Collectors.toUnmodifiableMap(PositionManager::getName, Function.identity()));
    }

    public StrategyAdapter getStrategy(String name) {
        requireName(name);
        StrategyAdapter adapter = strategies.get(name);
        if (adapter == null) {
            throw new ResourceNotFoundException("Strategy", name);
        }
        return adapter;
    }

    public PositionManager getPositionManager(String name) {
        requireName(name);
        PositionManager manager = positionManagers.get(name);
        if (manager == null) {
            throw new ResourceNotFoundException("PositionManager", name);
        }
        return manager;
    }

    public Set<String> strategyNames() {
        return new TreeSet<>(strategies.keySet());
    }

    public Set<String> positionManagerNames() {
        return new TreeSet<>(positionManagers.keySet());
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw VaultException.zeroAddress("name");
        }
    }
}
