package com.deltavault.unit.vault;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.deltavault.vault.VaultUnitOfWork;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link VaultUnitOfWork}: commit discards compensations, failure replays
 * them newest-first, and a failing compensation does not stop the rest.
 */
class VaultUnitOfWorkTest {

    @Test
    @DisplayName("Successful body commits and runs no compensations")
    void commitDiscards() {
        List<String> undone = new ArrayList<>();

        String result = VaultUnitOfWork.run("deposit", uow -> {
            uow.onRollback("step 1", () -> undone.add("step 1"));
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(undone).isEmpty();
    }

    @Test
    @DisplayName("Failure replays compensations in reverse order and rethrows the cause")
    void rollbackReverseOrder() {
        List<String> undone = new ArrayList<>();
        IllegalStateException cause = new IllegalStateException("leg rejected");

        assertThatThrownBy(() -> VaultUnitOfWork.run("withdraw", uow -> {
                    uow.onRollback("burn", () -> undone.add("burn"));
                    uow.onRollback("pull spot", () -> undone.add("pull spot"));
                    uow.onRollback("pull perp", () -> undone.add("pull perp"));
                    throw cause;
                }))
                .isSameAs(cause);

        assertThat(undone).containsExactly("pull perp", "pull spot", "burn");
    }

    @Test
    @DisplayName("Failing compensation is attached as suppressed and the rest still run")
    void failedCompensationSuppressed() {
        List<String> undone = new ArrayList<>();
        RuntimeException cause = new RuntimeException("short fill");

        assertThatThrownBy(() -> VaultUnitOfWork.run("deposit", uow -> {
                    uow.onRollback("refund", () -> undone.add("refund"));
                    uow.onRollback("recall spot", () -> {
                        throw new IllegalStateException("spot frozen");
                    });
                    throw cause;
                }))
                .isSameAs(cause);

        assertThat(undone).containsExactly("refund");
        assertThat(cause.getSuppressed()).hasSize(1);
        assertThat(cause.getSuppressed()[0]).hasMessage("spot frozen");
    }

    @Test
    @DisplayName("Registering after commit is rejected")
    void registerAfterCommit() {
        VaultUnitOfWork unitOfWork = new VaultUnitOfWork("deposit");
        unitOfWork.onRollback("step", () -> {});
        assertThat(unitOfWork.pendingCompensations()).isEqualTo(1);

        unitOfWork.commit();

        assertThat(unitOfWork.pendingCompensations()).isZero();
        assertThatThrownBy(() -> unitOfWork.onRollback("late", () -> {}))
                .isInstanceOf(IllegalStateException.class);
    }
}
