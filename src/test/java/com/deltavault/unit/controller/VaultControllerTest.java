package com.deltavault.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.deltavault.api.controller.VaultController;
import com.deltavault.config.ApiResponseAdvice;
import com.deltavault.domain.model.VaultSnapshot;
import com.deltavault.exception.GlobalExceptionHandler;
import com.deltavault.exception.VaultException;
import com.deltavault.vault.VaultCore;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the VaultController, including the error envelope
 * produced by GlobalExceptionHandler for vault failures.
 */
@ExtendWith(MockitoExtension.class)
class VaultControllerTest {

    private MockMvc mockMvc;

    @Mock
    private VaultCore vaultCore;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new VaultController(vaultCore))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/vault returns the snapshot wrapped in ApiResponse")
    void getSnapshot() throws Exception {
        when(vaultCore.snapshot())
                .thenReturn(VaultSnapshot.builder()
                        .owner("owner")
                        .paused(false)
                        .idleAssets(BigInteger.ZERO)
                        .spotAssets(BigInteger.valueOf(90))
                        .perpAssets(BigInteger.valueOf(75))
                        .totalAssets(BigInteger.valueOf(165))
                        .totalShares(BigInteger.valueOf(150))
                        .currentDelta(BigInteger.valueOf(15))
                        .spotStrategy("sim-spot")
                        .perpStrategy("sim-perp")
                        .positionManager("sim-delta")
                        .build());

        mockMvc.perform(get("/api/vault"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.totalAssets").value(165))
                .andExpect(jsonPath("$.data.totalShares").value(150))
                .andExpect(jsonPath("$.data.currentDelta").value(15))
                .andExpect(jsonPath("$.data.spotStrategy").value("sim-spot"))
                .andExpect(jsonPath("$.data.paused").value(false));
    }

    @Test
    @DisplayName("GET /api/vault/shares/{account} returns holder and total shares")
    void getShares() throws Exception {
        when(vaultCore.sharesOf("alice")).thenReturn(BigInteger.valueOf(100));
        when(vaultCore.totalShares()).thenReturn(BigInteger.valueOf(150));

        mockMvc.perform(get("/api/vault/shares/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.account").value("alice"))
                .andExpect(jsonPath("$.data.shares").value(100))
                .andExpect(jsonPath("$.data.totalShares").value(150));
    }

    @Test
    @DisplayName("GET /api/vault/preview-withdraw returns the payout for a share amount")
    void previewWithdraw() throws Exception {
        when(vaultCore.previewWithdraw(BigInteger.valueOf(50))).thenReturn(BigInteger.valueOf(55));

        mockMvc.perform(get("/api/vault/preview-withdraw").param("shares", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.shares").value(50))
                .andExpect(jsonPath("$.data.assets").value(55));
    }

    @Test
    @DisplayName("Non-numeric preview parameter returns 400 BAD_REQUEST")
    void previewBadParameter() throws Exception {
        mockMvc.perform(get("/api/vault/preview-deposit").param("assets", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("Unknown route returns 404 NOT_FOUND")
    void unknownRoute() throws Exception {
        mockMvc.perform(get("/api/vault/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.path").value("/api/vault/nope"));
    }

    @Test
    @DisplayName("GET on a POST-only endpoint returns 405 METHOD_NOT_ALLOWED")
    void wrongMethod() throws Exception {
        mockMvc.perform(get("/api/vault/deposit"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error.code").value("METHOD_NOT_ALLOWED"))
                .andExpect(jsonPath("$.error.details.supported[0]").value("POST"));

        verify(vaultCore, never()).deposit(anyString(), any());
    }

    @Test
    @DisplayName("POST /api/vault/deposit returns a receipt with minted shares")
    void deposit() throws Exception {
        when(vaultCore.deposit("alice", BigInteger.valueOf(100))).thenReturn(BigInteger.valueOf(100));

        mockMvc.perform(post("/api/vault/deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "account": "alice", "assets": 100 }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.account").value("alice"))
                .andExpect(jsonPath("$.data.assets").value(100))
                .andExpect(jsonPath("$.data.shares").value(100));
    }

    @Test
    @DisplayName("Deposit below minimum maps to 400 DEPOSIT_TOO_SMALL with details")
    void depositTooSmall() throws Exception {
        when(vaultCore.deposit("alice", BigInteger.valueOf(5)))
                .thenThrow(VaultException.depositTooSmall(BigInteger.valueOf(5), BigInteger.TEN));

        mockMvc.perform(post("/api/vault/deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "account": "alice", "assets": 5 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("DEPOSIT_TOO_SMALL"))
                .andExpect(jsonPath("$.error.details.minDeposit").value(10))
                .andExpect(jsonPath("$.error.path").value("/api/vault/deposit"));
    }

    @Test
    @DisplayName("Deposit without an account fails validation before reaching the vault")
    void depositMissingAccount() throws Exception {
        mockMvc.perform(post("/api/vault/deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "assets": 100 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.account").exists());

        verify(vaultCore, never()).deposit(anyString(), any());
    }

    @Test
    @DisplayName("Withdraw while paused maps to 423 VAULT_PAUSED")
    void withdrawWhilePaused() throws Exception {
        when(vaultCore.withdraw("alice", BigInteger.TEN)).thenThrow(VaultException.vaultPaused());

        mockMvc.perform(post("/api/vault/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "account": "alice", "shares": 10 }
                                """))
                .andExpect(status().is(423))
                .andExpect(jsonPath("$.error.code").value("VAULT_PAUSED"));
    }

    @Test
    @DisplayName("POST /api/vault/withdraw returns a receipt with paid assets")
    void withdraw() throws Exception {
        when(vaultCore.withdraw("bob", BigInteger.valueOf(50))).thenReturn(BigInteger.valueOf(55));

        mockMvc.perform(post("/api/vault/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "account": "bob", "shares": 50 }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.shares").value(50))
                .andExpect(jsonPath("$.data.assets").value(55));
    }

    @Test
    @DisplayName("POST /api/vault/transfer moves shares")
    void transfer() throws Exception {
        mockMvc.perform(post("/api/vault/transfer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "account": "alice", "to": "bob", "shares": 30 }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.to").value("bob"));

        verify(vaultCore).transferShares("alice", "bob", BigInteger.valueOf(30));
    }

    @Test
    @DisplayName("Rebalance inside tolerance maps to 409 REBALANCE_NOT_NEEDED")
    void rebalanceNotNeeded() throws Exception {
        doThrow(VaultException.rebalanceNotNeeded()).when(vaultCore).rebalance();

        mockMvc.perform(post("/api/vault/rebalance"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("REBALANCE_NOT_NEEDED"));
    }

    @Test
    @DisplayName("Unexpected adapter failure maps to 500 without leaking its message")
    void unexpectedFailure() throws Exception {
        when(vaultCore.deposit("alice", BigInteger.valueOf(100))).thenThrow(new IllegalStateException("rpc down"));

        mockMvc.perform(post("/api/vault/deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "account": "alice", "assets": 100 }
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error.message").value("An unexpected error occurred"));
    }
}
