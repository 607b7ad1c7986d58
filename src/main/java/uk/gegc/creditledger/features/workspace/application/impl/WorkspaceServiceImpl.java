package uk.gegc.creditledger.features.workspace.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.api.dto.BalanceDto;
import uk.gegc.creditledger.features.billing.application.BillingProperties;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.workspace.api.dto.CreatePlanRequest;
import uk.gegc.creditledger.features.workspace.api.dto.CreateWorkspaceRequest;
import uk.gegc.creditledger.features.workspace.api.dto.PlanDto;
import uk.gegc.creditledger.features.workspace.api.dto.WorkspaceDto;
import uk.gegc.creditledger.features.workspace.application.WorkspaceService;
import uk.gegc.creditledger.features.workspace.domain.exception.PlanNotFoundException;
import uk.gegc.creditledger.features.workspace.domain.exception.WorkspaceNotFoundException;
import uk.gegc.creditledger.features.workspace.domain.model.Plan;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;
import uk.gegc.creditledger.features.workspace.infra.mapping.WorkspaceMapper;
import uk.gegc.creditledger.features.workspace.infra.repository.PlanRepository;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkspaceServiceImpl implements WorkspaceService {

    private final PlanRepository planRepository;
    private final WorkspaceRepository workspaceRepository;
    private final BillingService billingService;
    private final BillingProperties billingProperties;
    private final WorkspaceMapper workspaceMapper;
    private final Clock clock;

    @Override
    @Transactional
    public PlanDto createPlan(CreatePlanRequest request) {
        if (planRepository.existsByCode(request.code())) {
            throw new IllegalArgumentException("Plan " + request.code() + " already exists");
        }
        Plan plan = new Plan();
        plan.setCode(request.code());
        plan.setName(request.name());
        plan.setCreditLimit(request.creditLimit());
        plan.setOverageRate(request.overageRate());
        plan.setAllotmentCredits(request.allotmentCredits());
        plan.setCreatedAt(LocalDateTime.now(clock));
        plan = planRepository.save(plan);
        log.info("Created plan {} (limit={}, allotment={})", plan.getCode(),
                plan.isUnlimited() ? "unlimited" : plan.getCreditLimit(), plan.getAllotmentCredits());
        return workspaceMapper.toPlanDto(plan);
    }

    @Override
    @Transactional(readOnly = true)
    public PlanDto getPlan(String code) {
        return planRepository.findByCode(code)
                .map(workspaceMapper::toPlanDto)
                .orElseThrow(() -> new PlanNotFoundException(code));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PlanDto> listPlans() {
        return workspaceMapper.toPlanDtos(planRepository.findAll());
    }

    @Override
    public WorkspaceDto createWorkspace(CreateWorkspaceRequest request) {
        Plan plan = planRepository.findByCode(request.planCode())
                .orElseThrow(() -> new PlanNotFoundException(request.planCode()));

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime periodStart = now.truncatedTo(ChronoUnit.SECONDS);
        LocalDateTime periodEnd = periodStart.plusMonths(billingProperties.getBillingPeriodMonths());

        Workspace workspace = new Workspace();
        workspace.setName(request.name());
        workspace.setOwnerEmail(request.ownerEmail());
        workspace.setPlan(plan);
        workspace.setCreditLimitOverride(request.creditLimitOverride());
        workspace.setOverageRateOverride(request.overageRateOverride());
        workspace.setStripeCustomerId(request.stripeCustomerId());
        workspace.setBillingPeriodStart(periodStart);
        workspace.setBillingPeriodEnd(periodEnd);
        workspace.setCreatedAt(now);
        workspace.setUpdatedAt(now);
        workspace = workspaceRepository.save(workspace);
        log.info("Created workspace {} on plan {}", workspace.getId(), plan.getCode());

        billingService.startBillingPeriod(workspace.getId(), periodStart, periodEnd);
        return getWorkspace(workspace.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public WorkspaceDto getWorkspace(UUID workspaceId) {
        return workspaceRepository.findById(workspaceId)
                .map(workspaceMapper::toDto)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
    }

    @Override
    public BalanceDto startBillingPeriod(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        return billingService.startBillingPeriod(workspaceId, periodStart, periodEnd);
    }

    @Override
    public BalanceDto rollOverBillingPeriod(UUID workspaceId) {
        Workspace workspace = workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
        LocalDateTime nextStart = workspace.getBillingPeriodEnd();
        LocalDateTime nextEnd = nextStart.plusMonths(billingProperties.getBillingPeriodMonths());
        return billingService.startBillingPeriod(workspaceId, nextStart, nextEnd);
    }
}
