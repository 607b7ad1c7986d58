package uk.gegc.creditledger.features.workspace.application;

import uk.gegc.creditledger.features.billing.api.dto.BalanceDto;
import uk.gegc.creditledger.features.workspace.api.dto.CreatePlanRequest;
import uk.gegc.creditledger.features.workspace.api.dto.CreateWorkspaceRequest;
import uk.gegc.creditledger.features.workspace.api.dto.PlanDto;
import uk.gegc.creditledger.features.workspace.api.dto.WorkspaceDto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface WorkspaceService {

    PlanDto createPlan(CreatePlanRequest request);

    PlanDto getPlan(String code);

    List<PlanDto> listPlans();

    /**
     * Creates the workspace with an empty balance and opens its first billing period,
     * which grants the plan allotment.
     */
    WorkspaceDto createWorkspace(CreateWorkspaceRequest request);

    WorkspaceDto getWorkspace(UUID workspaceId);

    BalanceDto startBillingPeriod(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd);

    /**
     * Opens the period that follows the current one, using the configured period length.
     */
    BalanceDto rollOverBillingPeriod(UUID workspaceId);
}
