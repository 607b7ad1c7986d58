package uk.gegc.creditledger.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService.ReconciliationResult;
import uk.gegc.creditledger.features.usage.api.dto.UsageReportDto;
import uk.gegc.creditledger.features.usage.api.dto.UsageVerificationDto;
import uk.gegc.creditledger.features.usage.application.UsageAggregationService;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Operator endpoints. Access control is enforced upstream by the platform gateway.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Billing Admin", description = "Ledger reconciliation and usage maintenance")
public class BillingAdminController {

    private final ReconciliationService reconciliationService;
    private final UsageAggregationService usageAggregationService;

    @Operation(summary = "Reconcile workspace",
            description = "Recomputes grants minus charges from the ledger and compares with the stored balance and held reservations.")
    @PostMapping("/billing/reconcile/{workspaceId}")
    public ResponseEntity<ReconciliationResult> reconcile(@PathVariable UUID workspaceId) {
        return ResponseEntity.ok(reconciliationService.reconcileWorkspace(workspaceId));
    }

    @Operation(summary = "Rebuild period usage",
            description = "Replays the ledger for the period and overwrites the usage summary.")
    @PostMapping("/usage/{workspaceId}/rebuild")
    public ResponseEntity<UsageReportDto> rebuildUsage(
            @PathVariable UUID workspaceId,
            @Parameter(description = "Billing period start", required = true)
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime periodStart) {
        return ResponseEntity.ok(usageAggregationService.rebuildPeriod(workspaceId, periodStart));
    }

    @Operation(summary = "Verify period usage",
            description = "Compares the usage summary with a ledger replay without writing.")
    @GetMapping("/usage/{workspaceId}/verify")
    public ResponseEntity<UsageVerificationDto> verifyUsage(
            @PathVariable UUID workspaceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime periodStart) {
        return ResponseEntity.ok(usageAggregationService.verifyPeriod(workspaceId, periodStart));
    }
}
