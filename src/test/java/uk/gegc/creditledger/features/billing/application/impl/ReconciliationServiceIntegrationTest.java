package uk.gegc.creditledger.features.billing.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import uk.gegc.creditledger.BaseIntegrationTest;
import uk.gegc.creditledger.features.billing.api.dto.ReservationDto;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService.ReconciliationResult;
import uk.gegc.creditledger.features.billing.application.ReconciliationService.ReconciliationSummary;
import uk.gegc.creditledger.features.workspace.api.dto.WorkspaceDto;
import uk.gegc.creditledger.features.workspace.domain.exception.WorkspaceNotFoundException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Ledger reconciliation")
class ReconciliationServiceIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ReconciliationService reconciliationService;
    @Autowired
    private BillingService billingService;

    @Test
    @DisplayName("a workspace written only through the ledger is balanced")
    void balancedWorkspace() {
        WorkspaceDto ws = fixtures.workspaceWithBalance(500);
        ReservationDto settled = fixtures.reserve(ws.id(), 100);
        billingService.settle(settled.id(), 40);
        fixtures.reserve(ws.id(), 60);

        ReconciliationResult result = reconciliationService.reconcileWorkspace(ws.id());

        assertThat(result.isBalanced()).isTrue();
        assertThat(result.hasDrift()).isFalse();
        assertThat(result.ledgerTotal()).isEqualTo(460L);
        assertThat(result.actualTotal()).isEqualTo(460L);
        assertThat(result.reserved()).isEqualTo(60L);
        assertThat(result.heldEstimates()).isEqualTo(60L);
    }

    @Test
    @DisplayName("a balance changed outside the ledger is reported as drift")
    void driftIsDetected() {
        WorkspaceDto ws = fixtures.workspaceWithBalance(500);
        jdbcTemplate.update("update workspaces set balance = balance + 7 where id = ?", ws.id());

        ReconciliationResult result = reconciliationService.reconcileWorkspace(ws.id());

        assertThat(result.isBalanced()).isFalse();
        assertThat(result.driftAmount()).isEqualTo(-7L);
        assertThat(result.details()).contains("Drift: -7");

        ReconciliationSummary summary = reconciliationService.reconcileAllWorkspaces();
        assertThat(summary.isSuccessful()).isFalse();
        assertThat(summary.driftResults()).extracting(ReconciliationResult::workspaceId).contains(ws.id());
        assertThat(summary.totalDriftAmount()).isGreaterThanOrEqualTo(7L);
    }

    @Test
    void unknownWorkspace() {
        assertThatThrownBy(() -> reconciliationService.reconcileWorkspace(UUID.randomUUID()))
                .isInstanceOf(WorkspaceNotFoundException.class);
    }
}
