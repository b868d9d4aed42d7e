package com.deltavault.api.controller;

import com.deltavault.api.dto.request.DepositRequest;
import com.deltavault.api.dto.request.TransferSharesRequest;
import com.deltavault.api.dto.request.WithdrawRequest;
import com.deltavault.domain.model.DepositReceipt;
import com.deltavault.domain.model.VaultSnapshot;
import com.deltavault.domain.model.WithdrawReceipt;
import com.deltavault.vault.VaultCore;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Depositor-facing REST endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/vault -- snapshot (balances, shares, delta, pause flag, collaborators)</li>
 *   <li>GET /api/vault/shares/{account} -- share balance of one holder</li>
 *   <li>GET /api/vault/preview-deposit?assets= -- shares a deposit would mint</li>
 *   <li>GET /api/vault/preview-withdraw?shares= -- assets a withdrawal would pay</li>
 *   <li>POST /api/vault/deposit -- deposit base asset</li>
 *   <li>POST /api/vault/withdraw -- burn shares for base asset</li>
 *   <li>POST /api/vault/transfer -- move shares to another holder</li>
 *   <li>POST /api/vault/rebalance -- request a rebalance from the position manager</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/vault")
public class VaultController {

    private static final Logger log = LoggerFactory.getLogger(VaultController.class);

    private final VaultCore vaultCore;

    public VaultController(VaultCore vaultCore) {
        this.vaultCore = vaultCore;
    }

    @GetMapping
    public ResponseEntity<VaultSnapshot> getSnapshot() {
        return ResponseEntity.ok(vaultCore.snapshot());
    }

    @GetMapping("/shares/{account}")
    public ResponseEntity<Map<String, Object>> getShares(@PathVariable String account) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("account", account);
        body.put("shares", vaultCore.sharesOf(account));
        body.put("totalShares", vaultCore.totalShares());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/preview-deposit")
    public ResponseEntity<Map<String, BigInteger>> previewDeposit(@RequestParam BigInteger assets) {
        return ResponseEntity.ok(Map.of("assets", assets, "shares", vaultCore.previewDeposit(assets)));
    }

    @GetMapping("/preview-withdraw")
    public ResponseEntity<Map<String, BigInteger>> previewWithdraw(@RequestParam BigInteger shares) {
        return ResponseEntity.ok(Map.of("shares", shares, "assets", vaultCore.previewWithdraw(shares)));
    }

    @PostMapping("/deposit")
    public ResponseEntity<DepositReceipt> deposit(@Valid @RequestBody DepositRequest request) {
        log.info("Deposit requested: account={}, assets={}", request.getAccount(), request.getAssets());
        BigInteger shares = vaultCore.deposit(request.getAccount(), request.getAssets());
        return ResponseEntity.ok(new DepositReceipt(request.getAccount(), request.getAssets(), shares));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<WithdrawReceipt> withdraw(@Valid @RequestBody WithdrawRequest request) {
        log.info("Withdraw requested: account={}, shares={}", request.getAccount(), request.getShares());
        BigInteger assets = vaultCore.withdraw(request.getAccount(), request.getShares());
        return ResponseEntity.ok(new WithdrawReceipt(request.getAccount(), request.getShares(), assets));
    }

    @PostMapping("/transfer")
    public ResponseEntity<Map<String, Object>> transfer(@Valid @RequestBody TransferSharesRequest request) {
        vaultCore.transferShares(request.getAccount(), request.getTo(), request.getShares());
        return ResponseEntity.ok(Map.of(
                "from", request.getAccount(),
                "to", request.getTo(),
                "shares", request.getShares()));
    }

    @PostMapping("/rebalance")
    public ResponseEntity<VaultSnapshot> rebalance() {
        log.info("Rebalance requested");
        vaultCore.rebalance();
        return ResponseEntity.ok(vaultCore.snapshot());
    }
}
