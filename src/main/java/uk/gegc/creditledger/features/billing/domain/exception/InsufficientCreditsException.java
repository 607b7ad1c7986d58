package uk.gegc.creditledger.features.billing.domain.exception;

import java.util.UUID;

/**
 * Raised when a reservation would take the spendable balance below zero.
 * No ledger state is changed when this is thrown.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final UUID workspaceId;
    private final long required;
    private final long available;

    public InsufficientCreditsException(UUID workspaceId, long required, long available) {
        super("Insufficient credits: required " + required + ", available " + available);
        this.workspaceId = workspaceId;
        this.required = required;
        this.available = available;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }

    public long getShortfall() {
        return Math.max(0L, required - available);
    }
}
