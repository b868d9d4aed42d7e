package com.deltavault.api.controller;

import com.deltavault.api.dto.request.AdminRequest;
import com.deltavault.domain.model.VaultSnapshot;
import com.deltavault.strategy.CollaboratorRegistry;
import com.deltavault.vault.VaultCore;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Owner-only REST endpoints. The owner check itself is the vault's: these endpoints pass
 * the {@code caller} through and the vault rejects anyone else with NOT_OWNER.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/vault/admin/collaborators -- names that can be installed</li>
 *   <li>PUT /api/vault/admin/spot-strategy, /perp-strategy, /position-manager</li>
 *   <li>POST /api/vault/admin/pause, /unpause, /transfer-ownership</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/vault/admin")
public class VaultAdminController {

    private final VaultCore vaultCore;
    private final CollaboratorRegistry collaboratorRegistry;

    public VaultAdminController(VaultCore vaultCore, CollaboratorRegistry collaboratorRegistry) {
        this.vaultCore = vaultCore;
        this.collaboratorRegistry = collaboratorRegistry;
    }

    @GetMapping("/collaborators")
    public ResponseEntity<Map<String, Set<String>>> getCollaborators() {
        Map<String, Set<String>> body = new LinkedHashMap<>();
        body.put("strategies", collaboratorRegistry.strategyNames());
        body.put("positionManagers", collaboratorRegistry.positionManagerNames());
        return ResponseEntity.ok(body);
    }

    @PutMapping("/spot-strategy")
    public ResponseEntity<VaultSnapshot> setSpotStrategy(@Valid @RequestBody AdminRequest request) {
        vaultCore.setSpotStrategy(request.getCaller(), collaboratorRegistry.getStrategy(request.getTarget()));
        return ResponseEntity.ok(vaultCore.snapshot());
    }

    @PutMapping("/perp-strategy")
    public ResponseEntity<VaultSnapshot> setPerpStrategy(@Valid @RequestBody AdminRequest request) {
        vaultCore.setPerpStrategy(request.getCaller(), collaboratorRegistry.getStrategy(request.getTarget()));
        return ResponseEntity.ok(vaultCore.snapshot());
    }

    @PutMapping("/position-manager")
    public ResponseEntity<VaultSnapshot> setPositionManager(@Valid @RequestBody AdminRequest request) {
        vaultCore.setPositionManager(
                request.getCaller(), collaboratorRegistry.getPositionManager(request.getTarget()));
        return ResponseEntity.ok(vaultCore.snapshot());
    }

    @PostMapping("/pause")
    public ResponseEntity<VaultSnapshot> pause(@Valid @RequestBody AdminRequest request) {
        vaultCore.emergencyPause(request.getCaller());
        return ResponseEntity.ok(vaultCore.snapshot());
    }

    @PostMapping("/unpause")
    public ResponseEntity<VaultSnapshot> unpause(@Valid @RequestBody AdminRequest request) {
        vaultCore.emergencyUnpause(request.getCaller());
        return ResponseEntity.ok(vaultCore.snapshot());
    }

    @PostMapping("/transfer-ownership")
    public ResponseEntity<VaultSnapshot> transferOwnership(@Valid @RequestBody AdminRequest request) {
        vaultCore.transferOwnership(request.getCaller(), request.getTarget());
        return ResponseEntity.ok(vaultCore.snapshot());
    }
}
