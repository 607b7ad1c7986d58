package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * A balance mutation would leave the workspace in a state that breaks conservation or non-negativity.
 * Always fatal for the enclosing transaction.
 */
public class LedgerIntegrityException extends RuntimeException {
    public LedgerIntegrityException(String message) {
        super(message);
    }
}
