package uk.gegc.creditledger.features.overage.application.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.creditledger.features.overage.api.dto.OverageResultDto;
import uk.gegc.creditledger.features.overage.application.OverageService;
import uk.gegc.creditledger.features.overage.domain.model.OverageStatus;
import uk.gegc.creditledger.features.workspace.application.WorkspaceService;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BillingPeriodCloseSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-04-01T00:15:00Z");

    @Mock
    private WorkspaceRepository workspaceRepository;
    @Mock
    private OverageService overageService;
    @Mock
    private WorkspaceService workspaceService;

    private BillingPeriodCloseScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new BillingPeriodCloseScheduler(workspaceRepository, overageService, workspaceService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OverageResultDto withinLimit(UUID workspaceId) {
        return new OverageResultDto(workspaceId, LocalDateTime.of(2025, 3, 1, 0, 0), LocalDateTime.of(2025, 4, 1, 0, 0),
                OverageStatus.WITHIN_LIMIT, 10L, 1000L, 0L, new BigDecimal("0.01"), BigDecimal.ZERO, "usd",
                null, null, null);
    }

    @Test
    void evaluatesOverageBeforeRollingOver() {
        UUID workspaceId = UUID.randomUUID();
        when(workspaceRepository.findIdsWithPeriodEndedBefore(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC)))
                .thenReturn(List.of(workspaceId));
        when(overageService.evaluateCurrentPeriod(workspaceId)).thenReturn(withinLimit(workspaceId));

        scheduler.closeEndedPeriods();

        InOrder order = inOrder(overageService, workspaceService);
        order.verify(overageService).evaluateCurrentPeriod(workspaceId);
        order.verify(workspaceService).rollOverBillingPeriod(workspaceId);
    }

    @Test
    void failedEvaluationLeavesPeriodOpenAndContinues() {
        UUID failing = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        when(workspaceRepository.findIdsWithPeriodEndedBefore(any())).thenReturn(List.of(failing, healthy));
        when(overageService.evaluateCurrentPeriod(failing)).thenThrow(new IllegalStateException("db down"));
        when(overageService.evaluateCurrentPeriod(healthy)).thenReturn(withinLimit(healthy));

        scheduler.closeEndedPeriods();

        verify(workspaceService, never()).rollOverBillingPeriod(failing);
        verify(workspaceService).rollOverBillingPeriod(healthy);
    }

    @Test
    void nothingDue() {
        when(workspaceRepository.findIdsWithPeriodEndedBefore(any())).thenReturn(List.of());

        scheduler.closeEndedPeriods();

        verifyNoInteractions(overageService, workspaceService);
    }
}
