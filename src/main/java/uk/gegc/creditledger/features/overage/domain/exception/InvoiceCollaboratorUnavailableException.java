package uk.gegc.creditledger.features.overage.domain.exception;

/**
 * The invoicing collaborator rejected or could not receive an invoice item.
 * The overage charge stays pending and is retried by the scheduler.
 */
public class InvoiceCollaboratorUnavailableException extends RuntimeException {
    public InvoiceCollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvoiceCollaboratorUnavailableException(String message) {
        super(message);
    }
}
