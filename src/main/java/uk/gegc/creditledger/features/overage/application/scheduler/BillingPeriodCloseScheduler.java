package uk.gegc.creditledger.features.overage.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.overage.api.dto.OverageResultDto;
import uk.gegc.creditledger.features.overage.application.OverageService;
import uk.gegc.creditledger.features.workspace.application.WorkspaceService;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Closes billing periods that have ended: evaluates the period's overage, then opens the next period.
 * A workspace several periods behind advances one period per run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BillingPeriodCloseScheduler {

    private final WorkspaceRepository workspaceRepository;
    private final OverageService overageService;
    private final WorkspaceService workspaceService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${billing.period-close-delay-ms:900000}",
            initialDelayString = "${billing.period-close-initial-delay-ms:120000}")
    public void closeEndedPeriods() {
        List<UUID> due = workspaceRepository.findIdsWithPeriodEndedBefore(LocalDateTime.now(clock));
        if (due.isEmpty()) {
            return;
        }
        log.info("Closing billing periods for {} workspaces", due.size());
        for (UUID workspaceId : due) {
            try {
                closePeriod(workspaceId);
            } catch (RuntimeException e) {
                // Retried on the next run; the period stays open until overage is evaluated
                log.error("Failed to close billing period for workspace {}", workspaceId, e);
            }
        }
    }

    void closePeriod(UUID workspaceId) {
        OverageResultDto overage = overageService.evaluateCurrentPeriod(workspaceId);
        log.info("Workspace {} period [{}, {}) closed with overage status {} units={}",
                workspaceId, overage.periodStart(), overage.periodEnd(), overage.status(), overage.overageUnits());
        workspaceService.rollOverBillingPeriod(workspaceId);
    }
}
