package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransaction;
import uk.gegc.creditledger.features.billing.domain.model.ReservationState;
import uk.gegc.creditledger.features.billing.infra.repository.CreditTransactionRepository;
import uk.gegc.creditledger.features.billing.infra.repository.ReservationRepository;
import uk.gegc.creditledger.features.workspace.domain.exception.WorkspaceNotFoundException;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Weekly integrity check of the stored balance columns against the ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationServiceImpl implements ReconciliationService {

    private final WorkspaceRepository workspaceRepository;
    private final CreditTransactionRepository transactionRepository;
    private final ReservationRepository reservationRepository;
    private final BillingMetricsService metricsService;

    @Override
    @Transactional(readOnly = true)
    public ReconciliationResult reconcileWorkspace(UUID workspaceId) {
        Workspace workspace = workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));

        long actualTotal = workspace.getBalance() + workspace.getReserved();
        long ledgerTotal = calculateTotalFromTransactions(workspaceId);
        long driftAmount = ledgerTotal - actualTotal;
        long counterDrift = ledgerTotal - (workspace.getTotalGranted() - workspace.getTotalCharged());
        long heldEstimates = reservationRepository.sumEstimatedAmountByWorkspaceIdAndState(
                workspaceId, ReservationState.HELD);

        String details = String.format(
                "Ledger: %d, Actual: %d (balance: %d, reserved: %d), Drift: %d, Counter drift: %d, Held estimates: %d",
                ledgerTotal, actualTotal, workspace.getBalance(), workspace.getReserved(),
                driftAmount, counterDrift, heldEstimates);

        ReconciliationResult result = new ReconciliationResult(workspaceId, driftAmount == 0 && counterDrift == 0
                && heldEstimates == workspace.getReserved(), ledgerTotal, actualTotal, driftAmount, counterDrift,
                workspace.getReserved(), heldEstimates, details);

        if (result.hasDrift()) {
            metricsService.recordReconciliationDrift(workspaceId, driftAmount);
            log.warn("Reconciliation drift detected for workspace {}: {}", workspaceId, details);
        } else {
            metricsService.recordReconciliationSuccess(workspaceId);
        }
        return result;
    }

    @Override
    public ReconciliationSummary reconcileAllWorkspaces() {
        log.info("Starting reconciliation for all workspaces");

        List<UUID> workspaceIds = workspaceRepository.findAllIds();
        List<ReconciliationResult> driftResults = new ArrayList<>();
        int failed = 0;

        for (UUID workspaceId : workspaceIds) {
            try {
                ReconciliationResult result = reconcileWorkspace(workspaceId);
                if (result.hasDrift()) {
                    driftResults.add(result);
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Error during reconciliation for workspace {}: {}", workspaceId, e.getMessage(), e);
            }
        }

        int totalWorkspaces = workspaceIds.size() - failed;
        long totalDriftAmount = driftResults.stream()
                .mapToLong(r -> Math.abs(r.driftAmount()))
                .sum();
        ReconciliationSummary summary = new ReconciliationSummary(
                totalWorkspaces, totalWorkspaces - driftResults.size(), driftResults.size(),
                totalDriftAmount, driftResults);

        log.info("Reconciliation completed: {} workspaces, {} balanced, {} with drift, total drift: {}",
                summary.totalWorkspaces(), summary.balancedWorkspaces(), summary.workspacesWithDrift(),
                summary.totalDriftAmount());
        return summary;
    }

    /**
     * Runs every Sunday at 2 AM.
     */
    @Scheduled(cron = "${billing.reconciliation-cron:0 0 2 * * SUN}")
    public void performWeeklyReconciliation() {
        log.info("Starting weekly reconciliation job");
        ReconciliationSummary summary = reconcileAllWorkspaces();
        if (summary.isSuccessful()) {
            log.info("Weekly reconciliation completed successfully: {} workspaces balanced",
                    summary.balancedWorkspaces());
        } else {
            log.warn("Weekly reconciliation found issues: {} workspaces with drift, total drift: {} credits",
                    summary.workspacesWithDrift(), summary.totalDriftAmount());
        }
    }

    private long calculateTotalFromTransactions(UUID workspaceId) {
        long total = 0;
        for (CreditTransaction tx : transactionRepository.findByWorkspaceIdOrderByCreatedAtAsc(workspaceId)) {
            // Holds move credits between balance and reserved without changing the total
            if (!tx.getType().isHoldMovement()) {
                total += tx.getAmount();
            }
        }
        return total;
    }
}
