package com.deltavault.api.controller;

import com.deltavault.api.dto.request.SimulatorAmountRequest;
import com.deltavault.asset.InMemoryBaseAssetGateway;
import com.deltavault.exception.ResourceNotFoundException;
import com.deltavault.simulator.SimulatedStrategyAdapter;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simulator-only endpoints for funding accounts and moving simulated strategy balances.
 *
 * <ul>
 *   <li>POST /api/simulator/fund -- credit base asset to an account</li>
 *   <li>POST /api/simulator/yield -- accrue yield on a simulated strategy</li>
 *   <li>POST /api/simulator/loss -- realize a loss on a simulated strategy</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/simulator")
@ConditionalOnProperty(prefix = "deltavault.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatorController {

    private final InMemoryBaseAssetGateway baseAssetGateway;
    private final List<SimulatedStrategyAdapter> simulatedStrategies;

    public SimulatorController(
            InMemoryBaseAssetGateway baseAssetGateway, List<SimulatedStrategyAdapter> simulatedStrategies) {
        this.baseAssetGateway = baseAssetGateway;
        this.simulatedStrategies = simulatedStrategies;
    }

    @PostMapping("/fund")
    public ResponseEntity<Map<String, Object>> fund(@Valid @RequestBody SimulatorAmountRequest request) {
        baseAssetGateway.fund(request.getName(), request.getAmount());
        return ResponseEntity.ok(
                Map.of("account", request.getName(), "balance", baseAssetGateway.balanceOf(request.getName())));
    }

    @PostMapping("/yield")
    public ResponseEntity<Map<String, Object>> accrueYield(@Valid @RequestBody SimulatorAmountRequest request) {
        SimulatedStrategyAdapter strategy = findStrategy(request.getName());
        strategy.accrueYield(request.getAmount());
        return strategyBalance(strategy);
    }

    @PostMapping("/loss")
    public ResponseEntity<Map<String, Object>> realizeLoss(@Valid @RequestBody SimulatorAmountRequest request) {
        SimulatedStrategyAdapter strategy = findStrategy(request.getName());
        strategy.realizeLoss(request.getAmount());
        return strategyBalance(strategy);
    }

    private SimulatedStrategyAdapter findStrategy(String name) {
        return simulatedStrategies.stream()
                .filter(strategy -> strategy.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Simulated strategy", name));
    }

    private static ResponseEntity<Map<String, Object>> strategyBalance(SimulatedStrategyAdapter strategy) {
        BigInteger balance = strategy.totalAssets();
        return ResponseEntity.ok(Map.of("strategy", strategy.getName(), "totalAssets", balance));
    }
}
