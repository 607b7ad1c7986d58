package uk.gegc.creditledger.features.usage.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.domain.event.CreditsSettledEvent;
import uk.gegc.creditledger.features.billing.domain.event.OverageChargedEvent;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransaction;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;
import uk.gegc.creditledger.features.billing.infra.repository.CreditTransactionRepository;
import uk.gegc.creditledger.features.usage.api.dto.UsageBreakdownDto;
import uk.gegc.creditledger.features.usage.api.dto.UsageReportDto;
import uk.gegc.creditledger.features.usage.api.dto.UsageVerificationDto;
import uk.gegc.creditledger.features.usage.application.UsageAggregationService;
import uk.gegc.creditledger.features.usage.domain.model.UsageBreakdown;
import uk.gegc.creditledger.features.usage.domain.model.UsagePeriodSummary;
import uk.gegc.creditledger.features.usage.infra.repository.UsageBreakdownRepository;
import uk.gegc.creditledger.features.usage.infra.repository.UsagePeriodSummaryRepository;
import uk.gegc.creditledger.features.workspace.domain.exception.WorkspaceNotFoundException;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UsageAggregationServiceImpl implements UsageAggregationService {

    private final UsagePeriodSummaryRepository summaryRepository;
    private final UsageBreakdownRepository breakdownRepository;
    private final CreditTransactionRepository transactionRepository;
    private final WorkspaceRepository workspaceRepository;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordSettlement(CreditsSettledEvent event) {
        UsagePeriodSummary summary = loadOrCreateSummary(event.getWorkspaceId(), event.getPeriodStart());
        summary.setRequestCount(summary.getRequestCount() + 1);
        summary.setCreditsCharged(summary.getCreditsCharged() + event.getChargedAmount());
        summary.setUnitsReported(summary.getUnitsReported() + event.getActualAmount());
        summary.setAbsorbedCredits(summary.getAbsorbedCredits() + event.getAbsorbedAmount());
        summary.setUpdatedAt(LocalDateTime.now(clock));
        summaryRepository.save(summary);

        String serviceType = keyOf(event.getServiceType());
        String model = keyOf(event.getModel());
        String provider = keyOf(event.getProvider());
        UsageBreakdown breakdown = breakdownRepository
                .findByWorkspaceIdAndPeriodStartAndServiceTypeAndModelAndProvider(
                        event.getWorkspaceId(), event.getPeriodStart(), serviceType, model, provider)
                .orElseGet(() -> newBreakdown(event.getWorkspaceId(), event.getPeriodStart(), serviceType, model, provider));
        breakdown.setRequestCount(breakdown.getRequestCount() + 1);
        breakdown.setCreditsCharged(breakdown.getCreditsCharged() + event.getChargedAmount());
        breakdown.setUnitsReported(breakdown.getUnitsReported() + event.getActualAmount());
        breakdownRepository.save(breakdown);

        log.debug("Usage for workspace {} period {} now {} credits over {} requests",
                event.getWorkspaceId(), event.getPeriodStart(), summary.getCreditsCharged(), summary.getRequestCount());
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordOverage(OverageChargedEvent event) {
        UsagePeriodSummary summary = loadOrCreateSummary(event.getWorkspaceId(), event.getPeriodStart());
        summary.setOverageUnits(summary.getOverageUnits() + event.getOverageUnits());
        summary.setUpdatedAt(LocalDateTime.now(clock));
        summaryRepository.save(summary);
    }

    @Override
    @Transactional(readOnly = true)
    public UsageReportDto getPeriodUsage(UUID workspaceId, LocalDateTime periodStart) {
        if (!workspaceRepository.existsById(workspaceId)) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        UsagePeriodSummary summary = summaryRepository.findByWorkspaceIdAndPeriodStart(workspaceId, periodStart)
                .orElse(null);
        List<UsageBreakdown> rows = breakdownRepository
                .findByWorkspaceIdAndPeriodStartOrderByCreditsChargedDesc(workspaceId, periodStart);
        return toReport(workspaceId, periodStart, summary, rows);
    }

    @Override
    @Transactional(readOnly = true)
    public UsageReportDto getCurrentPeriodUsage(UUID workspaceId) {
        Workspace workspace = workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
        return getPeriodUsage(workspaceId, workspace.getBillingPeriodStart());
    }

    @Override
    @Transactional(readOnly = true)
    public long getCreditsCharged(UUID workspaceId, LocalDateTime periodStart) {
        return summaryRepository.findByWorkspaceIdAndPeriodStart(workspaceId, periodStart)
                .map(UsagePeriodSummary::getCreditsCharged)
                .orElse(0L);
    }

    @Override
    @Transactional
    public UsageReportDto rebuildPeriod(UUID workspaceId, LocalDateTime periodStart) {
        // Serialize with settlements, which write the summary under the same row lock
        workspaceRepository.findByIdForUpdate(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));

        Replay replay = replay(workspaceId, periodStart);

        breakdownRepository.deleteByPeriod(workspaceId, periodStart);
        List<UsageBreakdown> rows = new ArrayList<>();
        for (UsageBreakdown row : replay.breakdown.values()) {
            rows.add(breakdownRepository.save(row));
        }

        UsagePeriodSummary summary = loadOrCreateSummary(workspaceId, periodStart);
        summary.setRequestCount(replay.requestCount);
        summary.setCreditsCharged(replay.creditsCharged);
        summary.setUnitsReported(replay.unitsReported);
        summary.setAbsorbedCredits(replay.absorbedCredits);
        summary.setOverageUnits(replay.overageUnits);
        summary.setUpdatedAt(LocalDateTime.now(clock));
        summary = summaryRepository.save(summary);

        log.info("Rebuilt usage for workspace {} period {}: {} credits over {} requests",
                workspaceId, periodStart, replay.creditsCharged, replay.requestCount);
        rows.sort((a, b) -> Long.compare(b.getCreditsCharged(), a.getCreditsCharged()));
        return toReport(workspaceId, periodStart, summary, rows);
    }

    @Override
    @Transactional(readOnly = true)
    public UsageVerificationDto verifyPeriod(UUID workspaceId, LocalDateTime periodStart) {
        if (!workspaceRepository.existsById(workspaceId)) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        Replay replay = replay(workspaceId, periodStart);
        UsagePeriodSummary summary = summaryRepository.findByWorkspaceIdAndPeriodStart(workspaceId, periodStart)
                .orElseGet(UsagePeriodSummary::new);
        boolean consistent = summary.getCreditsCharged() == replay.creditsCharged
                && summary.getRequestCount() == replay.requestCount
                && summary.getOverageUnits() == replay.overageUnits;
        if (!consistent) {
            log.warn("Usage summary drift for workspace {} period {}: summary={} ledger={}",
                    workspaceId, periodStart, summary.getCreditsCharged(), replay.creditsCharged);
        }
        return new UsageVerificationDto(workspaceId, periodStart, consistent,
                summary.getCreditsCharged(), replay.creditsCharged,
                summary.getRequestCount(), replay.requestCount,
                summary.getOverageUnits(), replay.overageUnits);
    }

    private Replay replay(UUID workspaceId, LocalDateTime periodStart) {
        List<CreditTransaction> entries = transactionRepository.findByWorkspaceIdAndPeriodStartAndTypeIn(
                workspaceId, periodStart,
                EnumSet.of(CreditTransactionType.SETTLE, CreditTransactionType.OVERAGE_CHARGE,
                        CreditTransactionType.ADJUSTMENT));
        Replay replay = new Replay();
        for (CreditTransaction tx : entries) {
            switch (tx.getType()) {
                case SETTLE -> {
                    long charged = -tx.getAmount();
                    long units = tx.getUnits() != null ? tx.getUnits() : charged;
                    replay.requestCount++;
                    replay.creditsCharged += charged;
                    replay.unitsReported += units;
                    String serviceType = keyOf(tx.getServiceType());
                    String model = keyOf(tx.getModel());
                    String provider = keyOf(tx.getProvider());
                    UsageBreakdown row = replay.breakdown.computeIfAbsent(serviceType + "|" + model + "|" + provider,
                            k -> newBreakdown(workspaceId, periodStart, serviceType, model, provider));
                    row.setRequestCount(row.getRequestCount() + 1);
                    row.setCreditsCharged(row.getCreditsCharged() + charged);
                    row.setUnitsReported(row.getUnitsReported() + units);
                }
                case OVERAGE_CHARGE -> replay.overageUnits += tx.getUnits() != null ? tx.getUnits() : 0L;
                case ADJUSTMENT -> replay.absorbedCredits += tx.getUnits() != null ? tx.getUnits() : 0L;
                default -> {
                }
            }
        }
        return replay;
    }

    private UsagePeriodSummary loadOrCreateSummary(UUID workspaceId, LocalDateTime periodStart) {
        return summaryRepository.findByWorkspaceIdAndPeriodStart(workspaceId, periodStart)
                .orElseGet(() -> {
                    UsagePeriodSummary summary = new UsagePeriodSummary();
                    summary.setWorkspaceId(workspaceId);
                    summary.setPeriodStart(periodStart);
                    return summary;
                });
    }

    private static UsageBreakdown newBreakdown(UUID workspaceId, LocalDateTime periodStart,
                                               String serviceType, String model, String provider) {
        UsageBreakdown breakdown = new UsageBreakdown();
        breakdown.setWorkspaceId(workspaceId);
        breakdown.setPeriodStart(periodStart);
        breakdown.setServiceType(serviceType);
        breakdown.setModel(model);
        breakdown.setProvider(provider);
        return breakdown;
    }

    private static UsageReportDto toReport(UUID workspaceId, LocalDateTime periodStart,
                                           UsagePeriodSummary summary, List<UsageBreakdown> rows) {
        Map<String, Long> byServiceType = new LinkedHashMap<>();
        List<UsageBreakdownDto> breakdown = new ArrayList<>(rows.size());
        for (UsageBreakdown row : rows) {
            byServiceType.merge(row.getServiceType(), row.getCreditsCharged(), Long::sum);
            breakdown.add(new UsageBreakdownDto(row.getServiceType(), row.getModel(), row.getProvider(),
                    row.getRequestCount(), row.getCreditsCharged(), row.getUnitsReported()));
        }
        if (summary == null) {
            return new UsageReportDto(workspaceId, periodStart, 0L, 0L, 0L, 0L, 0L, byServiceType, breakdown);
        }
        return new UsageReportDto(workspaceId, periodStart, summary.getRequestCount(), summary.getCreditsCharged(),
                summary.getUnitsReported(), summary.getAbsorbedCredits(), summary.getOverageUnits(),
                byServiceType, breakdown);
    }

    private static String keyOf(ServiceType serviceType) {
        return serviceType == null ? UsageBreakdown.UNSPECIFIED : serviceType.name();
    }

    private static String keyOf(String value) {
        return value == null || value.isBlank() ? UsageBreakdown.UNSPECIFIED : value.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Replay {
        private long requestCount;
        private long creditsCharged;
        private long unitsReported;
        private long absorbedCredits;
        private long overageUnits;
        private final Map<String, UsageBreakdown> breakdown = new LinkedHashMap<>();
    }
}
