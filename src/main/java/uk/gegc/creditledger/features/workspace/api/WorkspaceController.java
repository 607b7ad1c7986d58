package uk.gegc.creditledger.features.workspace.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.creditledger.features.billing.api.dto.AdjustmentRequest;
import uk.gegc.creditledger.features.billing.api.dto.BalanceDto;
import uk.gegc.creditledger.features.billing.api.dto.PurchaseRequest;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;
import uk.gegc.creditledger.features.workspace.api.dto.CreateWorkspaceRequest;
import uk.gegc.creditledger.features.workspace.api.dto.StartBillingPeriodRequest;
import uk.gegc.creditledger.features.workspace.api.dto.WorkspaceDto;
import uk.gegc.creditledger.features.workspace.application.WorkspaceService;

import java.time.LocalDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/workspaces")
@RequiredArgsConstructor
@Tag(name = "Workspaces", description = "Workspaces, balances, grants and the transaction ledger")
public class WorkspaceController {

    private final WorkspaceService workspaceService;
    private final BillingService billingService;

    @Operation(summary = "Create workspace", description = "Opens the first billing period and grants the plan allotment.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Workspace created",
                    content = @Content(schema = @Schema(implementation = WorkspaceDto.class))),
            @ApiResponse(responseCode = "404", description = "Plan not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<WorkspaceDto> createWorkspace(@Valid @RequestBody CreateWorkspaceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workspaceService.createWorkspace(request));
    }

    @Operation(summary = "Get workspace")
    @GetMapping("/{workspaceId}")
    public ResponseEntity<WorkspaceDto> getWorkspace(@PathVariable UUID workspaceId) {
        return ResponseEntity.ok(workspaceService.getWorkspace(workspaceId));
    }

    @Operation(summary = "Start billing period",
            description = "Moves the workspace into a new billing period and grants the plan allotment once per period.")
    @PostMapping("/{workspaceId}/billing-periods")
    public ResponseEntity<BalanceDto> startBillingPeriod(@PathVariable UUID workspaceId,
                                                         @Valid @RequestBody StartBillingPeriodRequest request) {
        return ResponseEntity.ok(workspaceService.startBillingPeriod(workspaceId, request.periodStart(), request.periodEnd()));
    }

    @Operation(summary = "Get balance")
    @GetMapping("/{workspaceId}/balance")
    public ResponseEntity<BalanceDto> getBalance(@PathVariable UUID workspaceId) {
        return ResponseEntity.ok()
                .header("Cache-Control", "no-store")
                .body(billingService.getBalance(workspaceId));
    }

    @Operation(summary = "List transactions", description = "Newest first, optionally filtered by type and creation time.")
    @GetMapping("/{workspaceId}/transactions")
    public ResponseEntity<Page<TransactionDto>> listTransactions(
            @PathVariable UUID workspaceId,
            @Parameter(description = "Transaction type filter") @RequestParam(required = false) CreditTransactionType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTo,
            @PageableDefault(size = 20) Pageable pageable) {
        return ResponseEntity.ok(billingService.listTransactions(workspaceId, pageable, type, dateFrom, dateTo));
    }

    @Operation(summary = "Credit purchase", description = "Grants purchased credits. Called by the checkout integration.")
    @PostMapping("/{workspaceId}/purchases")
    public ResponseEntity<TransactionDto> creditPurchase(@PathVariable UUID workspaceId,
                                                         @Valid @RequestBody PurchaseRequest request) {
        TransactionDto tx = billingService.creditPurchase(workspaceId, request.credits(),
                request.idempotencyKey(), request.reference());
        return ResponseEntity.status(HttpStatus.CREATED).body(tx);
    }

    @Operation(summary = "Admin adjustment", description = "Signed correction; negative values never take the balance below zero.")
    @PostMapping("/{workspaceId}/adjustments")
    public ResponseEntity<TransactionDto> creditAdjustment(@PathVariable UUID workspaceId,
                                                           @Valid @RequestBody AdjustmentRequest request) {
        TransactionDto tx = billingService.creditAdjustment(workspaceId, request.credits(),
                request.idempotencyKey(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(tx);
    }
}
