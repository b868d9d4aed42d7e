package com.deltavault.vault;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undo journal for one mutating vault operation.
 *
 * <p>Each committed step (asset collected, idle balance moved, shares minted or burned,
 * capital deployed to or recalled from a strategy) registers the action that reverses
 * it. If the operation throws, the actions replay newest-first and the original
 * exception is rethrown, leaving the vault and its collaborators as they were before
 * the call.
 *
 * <p>A compensation that fails does not stop the remaining ones. Its exception is
 * logged and attached to the original failure as suppressed.
 */
public class VaultUnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(VaultUnitOfWork.class);

    private final String operation;
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private boolean completed;

    public VaultUnitOfWork(String operation) {
        this.operation = operation;
    }

    /**
     * Runs {@code body} inside a new unit of work, committing on normal return and
     * rolling back on any runtime exception.
     */
    public static <T> T run(String operation, Function<VaultUnitOfWork, T> body) {
        VaultUnitOfWork unitOfWork = new VaultUnitOfWork(operation);
        try {
            T result = body.apply(unitOfWork);
            unitOfWork.commit();
            return result;
        } catch (RuntimeException e) {
            unitOfWork.rollback(e);
            throw e;
        }
    }

    public void onRollback(String description, Runnable action) {
        if (completed) {
            throw new IllegalStateException("Unit of work for " + operation + " already completed");
        }
        compensations.push(new Compensation(description, action));
    }

    public void commit() {
        completed = true;
        compensations.clear();
    }

    public void rollback(RuntimeException cause) {
        if (completed) {
            return;
        }
        completed = true;
        if (compensations.isEmpty()) {
            return;
        }

        log.warn("Rolling back {} ({} steps): {}", operation, compensations.size(), cause.getMessage());
        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                compensation.action().run();
            } catch (RuntimeException e) {
                log.error("Rollback step FAILED for {}: {}", operation, compensation.description(), e);
                cause.addSuppressed(e);
            }
        }
    }

    public int pendingCompensations() {
        return compensations.size();
    }

    private record Compensation(String description, Runnable action) {}
}
