package uk.gegc.creditledger.features.overage.application;

import uk.gegc.creditledger.features.overage.domain.exception.InvoiceCollaboratorUnavailableException;

import java.util.Map;

/**
 * External invoicing service that turns an overage charge into an invoice item.
 */
public interface InvoiceCollaborator {

    /**
     * Creates an invoice item. Repeating a call with the same idempotency key must not create a second item.
     *
     * @return the collaborator's id for the invoice item
     * @throws InvoiceCollaboratorUnavailableException when the item could not be created
     */
    String createInvoiceItem(InvoiceItemRequest request);

    record InvoiceItemRequest(
            String customerId,
            long amountMinorUnits,
            String currency,
            String description,
            String idempotencyKey,
            Map<String, String> metadata
    ) {}
}
