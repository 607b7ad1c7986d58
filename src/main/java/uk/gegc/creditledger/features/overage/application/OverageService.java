package uk.gegc.creditledger.features.overage.application;

import uk.gegc.creditledger.features.overage.api.dto.OverageResultDto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface OverageService {

    /**
     * Compares the period's charged credits with the plan limit and, when there is a charge, records it
     * in the ledger and hands an invoice item to the invoicing collaborator. Once a period's overage is
     * recorded, later evaluations return the recorded figures and never emit a second invoice item.
     */
    OverageResultDto evaluate(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd);

    OverageResultDto evaluateCurrentPeriod(UUID workspaceId);

    /**
     * Current-period figures without side effects.
     */
    OverageResultDto preview(UUID workspaceId);

    List<OverageResultDto> listCharges(UUID workspaceId);

    /**
     * Resubmits invoice items the collaborator has not accepted yet.
     *
     * @return number of items invoiced in this run
     */
    int retryPendingInvoices();
}
