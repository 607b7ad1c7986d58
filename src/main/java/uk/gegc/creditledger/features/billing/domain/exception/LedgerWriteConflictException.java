package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * Concurrent writers kept colliding on the same workspace row and the bounded retry budget ran out.
 */
public class LedgerWriteConflictException extends RuntimeException {

    private final int attempts;

    public LedgerWriteConflictException(String operation, int attempts, Throwable cause) {
        super("Ledger write conflict during " + operation + " after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
