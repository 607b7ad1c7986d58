package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * An idempotency key was reused with a different payload.
 */
public class IdempotencyConflictException extends RuntimeException {
    public IdempotencyConflictException(String message) {
        super(message);
    }
}
