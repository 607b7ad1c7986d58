package uk.gegc.creditledger.features.billing.application;

import java.util.List;
import java.util.UUID;

/**
 * Recomputes workspace totals from the ledger and compares them with the stored balance columns.
 */
public interface ReconciliationService {

    ReconciliationResult reconcileWorkspace(UUID workspaceId);

    ReconciliationSummary reconcileAllWorkspaces();

    /**
     * Result of reconciliation for a single workspace.
     *
     * @param ledgerTotal   grants minus charges summed from the ledger
     * @param actualTotal   stored {@code balance + reserved}
     * @param heldEstimates sum of estimates of HELD reservations
     */
    record ReconciliationResult(
            UUID workspaceId,
            boolean isBalanced,
            long ledgerTotal,
            long actualTotal,
            long driftAmount,
            long counterDrift,
            long reserved,
            long heldEstimates,
            String details
    ) {
        public boolean hasDrift() {
            return driftAmount != 0 || counterDrift != 0 || reserved != heldEstimates;
        }
    }

    record ReconciliationSummary(
            int totalWorkspaces,
            int balancedWorkspaces,
            int workspacesWithDrift,
            long totalDriftAmount,
            List<ReconciliationResult> driftResults
    ) {
        public boolean isSuccessful() {
            return workspacesWithDrift == 0;
        }
    }
}
