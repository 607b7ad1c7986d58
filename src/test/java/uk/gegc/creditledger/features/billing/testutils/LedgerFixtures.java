package uk.gegc.creditledger.features.billing.testutils;

import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.billing.api.dto.ReservationDto;
import uk.gegc.creditledger.features.billing.api.dto.ReserveRequest;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;
import uk.gegc.creditledger.features.workspace.api.dto.CreatePlanRequest;
import uk.gegc.creditledger.features.workspace.api.dto.CreateWorkspaceRequest;
import uk.gegc.creditledger.features.workspace.api.dto.PlanDto;
import uk.gegc.creditledger.features.workspace.api.dto.WorkspaceDto;
import uk.gegc.creditledger.features.workspace.application.WorkspaceService;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Creates plans, workspaces and reservations through the public services so every
 * fixture carries a real ledger history.
 */
@Component
public class LedgerFixtures {

    private final WorkspaceService workspaceService;
    private final BillingService billingService;

    public LedgerFixtures(WorkspaceService workspaceService, BillingService billingService) {
        this.workspaceService = workspaceService;
        this.billingService = billingService;
    }

    public PlanDto plan(Long creditLimit, BigDecimal overageRate, long allotment) {
        String code = "plan-" + UUID.randomUUID().toString().substring(0, 8);
        return workspaceService.createPlan(new CreatePlanRequest(code, "Test " + code, creditLimit, overageRate, allotment));
    }

    /**
     * Unlimited plan whose allotment becomes the opening balance.
     */
    public WorkspaceDto workspaceWithBalance(long balance) {
        PlanDto plan = plan(null, null, balance);
        return workspace(plan, null);
    }

    public WorkspaceDto workspace(PlanDto plan, String stripeCustomerId) {
        return workspaceService.createWorkspace(new CreateWorkspaceRequest(
                "Workspace " + UUID.randomUUID().toString().substring(0, 8),
                "owner@example.com",
                plan.code(),
                null,
                null,
                stripeCustomerId));
    }

    public ReservationDto reserve(UUID workspaceId, long estimate) {
        return reserve(workspaceId, estimate, "gpt-4o");
    }

    public ReservationDto reserve(UUID workspaceId, long estimate, String model) {
        return billingService.reserve(new ReserveRequest(workspaceId, "req-" + UUID.randomUUID(), estimate,
                ServiceType.TEXT, model, "openai"));
    }
}
