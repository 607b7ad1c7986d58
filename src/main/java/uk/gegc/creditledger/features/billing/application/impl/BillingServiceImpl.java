package uk.gegc.creditledger.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.api.dto.BalanceDto;
import uk.gegc.creditledger.features.billing.api.dto.ReleaseResultDto;
import uk.gegc.creditledger.features.billing.api.dto.ReservationDto;
import uk.gegc.creditledger.features.billing.api.dto.ReserveRequest;
import uk.gegc.creditledger.features.billing.api.dto.SettlementResultDto;
import uk.gegc.creditledger.features.billing.api.dto.TerminalOutcome;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.BillingProperties;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.billing.application.BillingStructuredLogger;
import uk.gegc.creditledger.features.billing.application.LedgerWriteExecutor;
import uk.gegc.creditledger.features.billing.domain.event.CreditsSettledEvent;
import uk.gegc.creditledger.features.billing.domain.event.OverageChargedEvent;
import uk.gegc.creditledger.features.billing.domain.exception.IdempotencyConflictException;
import uk.gegc.creditledger.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.creditledger.features.billing.domain.exception.LedgerIntegrityException;
import uk.gegc.creditledger.features.billing.domain.exception.ReservationNotFoundException;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransaction;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionSource;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;
import uk.gegc.creditledger.features.billing.domain.model.Reservation;
import uk.gegc.creditledger.features.billing.domain.model.ReservationState;
import uk.gegc.creditledger.features.billing.infra.mapping.BalanceMapper;
import uk.gegc.creditledger.features.billing.infra.mapping.ReservationMapper;
import uk.gegc.creditledger.features.billing.infra.mapping.TransactionMapper;
import uk.gegc.creditledger.features.billing.infra.repository.CreditTransactionRepository;
import uk.gegc.creditledger.features.billing.infra.repository.ReservationRepository;
import uk.gegc.creditledger.features.workspace.domain.exception.WorkspaceNotFoundException;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.LongFunction;

@Service
@RequiredArgsConstructor
public class BillingServiceImpl implements BillingService {

    private static final Logger log = LoggerFactory.getLogger(BillingServiceImpl.class);

    static final long MAX_CREDITS = 1_000_000_000L;
    static final String EXPIRED_REASON = "expired";

    private final BillingProperties billingProperties;
    private final WorkspaceRepository workspaceRepository;
    private final CreditTransactionRepository transactionRepository;
    private final ReservationRepository reservationRepository;
    private final LedgerWriteExecutor ledgerWriteExecutor;

    private final BalanceMapper balanceMapper;
    private final TransactionMapper transactionMapper;
    private final ReservationMapper reservationMapper;

    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(UUID workspaceId) {
        Workspace workspace = workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
        return balanceMapper.toDto(workspace);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<TransactionDto> listTransactions(UUID workspaceId, Pageable pageable,
                                                 CreditTransactionType type,
                                                 LocalDateTime dateFrom, LocalDateTime dateTo) {
        if (!workspaceRepository.existsById(workspaceId)) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        return transactionRepository.findByFilters(workspaceId, type, dateFrom, dateTo, pageable)
                .map(transactionMapper::toDto);
    }

    @Override
    public ReservationDto reserve(ReserveRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        requireAmountInRange(request.estimatedCredits(), 0L, "estimatedCredits");
        try {
            return ledgerWriteExecutor.execute("reserve", () -> performReserve(request));
        } catch (DataIntegrityViolationException ex) {
            // Same request id admitted concurrently against another workspace row
            Reservation existing = reservationRepository.findByRequestId(request.requestId())
                    .orElseThrow(() -> ex);
            return reservationMapper.toDto(requireSameReservation(existing, request));
        }
    }

    private ReservationDto performReserve(ReserveRequest request) {
        Workspace workspace = lockWorkspace(request.workspaceId());

        Optional<Reservation> existing = reservationRepository.findByRequestId(request.requestId());
        if (existing.isPresent()) {
            log.info("Reserve replay for requestId={} returns reservation {}", request.requestId(), existing.get().getId());
            return reservationMapper.toDto(requireSameReservation(existing.get(), request));
        }

        long estimate = request.estimatedCredits();
        if (workspace.getBalance() < estimate) {
            metricsService.incrementInsufficientCredits(workspace.getId());
            throw new InsufficientCreditsException(workspace.getId(), estimate, workspace.getBalance());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        workspace.setBalance(workspace.getBalance() - estimate);
        workspace.setReserved(workspace.getReserved() + estimate);
        workspace.setUpdatedAt(now);
        verifyIntegrity(workspace, "reserve");

        Reservation reservation = new Reservation();
        reservation.setWorkspaceId(workspace.getId());
        reservation.setRequestId(request.requestId());
        reservation.setState(ReservationState.HELD);
        reservation.setEstimatedAmount(estimate);
        reservation.setServiceType(request.serviceType());
        reservation.setModel(request.model());
        reservation.setProvider(request.provider());
        reservation.setCreatedAt(now);
        reservation.setExpiresAt(now.plusMinutes(billingProperties.getReservationTtlMinutes()));
        reservation = reservationRepository.save(reservation);

        CreditTransaction tx = newTransaction(workspace, CreditTransactionType.RESERVE,
                CreditTransactionSource.ORCHESTRATOR, -estimate, now);
        tx.setReservationId(reservation.getId());
        tx.setRelatedRequestId(request.requestId());
        tx.setIdempotencyKey("reserve:" + request.requestId());
        tx.setDescription("Hold for request " + request.requestId());
        appendTransaction(tx, reservation.getId().toString());

        BillingStructuredLogger.logReservationOperation(log, "info",
                "Reserved {} credits for workspace {} (reservation {})",
                workspace.getId(), "RESERVE", estimate, reservation.getId(),
                estimate, workspace.getId(), reservation.getId());
        metricsService.incrementReservationCreated(workspace.getId(), estimate);
        return reservationMapper.toDto(reservation);
    }

    private Reservation requireSameReservation(Reservation existing, ReserveRequest request) {
        if (!existing.getWorkspaceId().equals(request.workspaceId())
                || existing.getEstimatedAmount() != request.estimatedCredits()) {
            throw new IdempotencyConflictException("Request " + request.requestId()
                    + " was already admitted with a different workspace or estimate");
        }
        return existing;
    }

    @Override
    @Transactional(readOnly = true)
    public ReservationDto getReservation(UUID reservationId) {
        return reservationRepository.findById(reservationId)
                .map(reservationMapper::toDto)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }

    @Override
    public SettlementResultDto settle(UUID reservationId, long actualAmount) {
        requireAmountInRange(actualAmount, 0L, "actualAmount");
        return ledgerWriteExecutor.execute("settle", () -> performSettle(reservationId, actualAmount));
    }

    private SettlementResultDto performSettle(UUID reservationId, long actualAmount) {
        Reservation reservation = reservationRepository.findByIdForUpdate(reservationId).orElse(null);
        if (reservation == null) {
            log.warn("Settle for unknown reservation {} ignored", reservationId);
            return SettlementResultDto.notFound(reservationId);
        }
        if (reservation.getState().isTerminal()) {
            if (reservation.getState() == ReservationState.SETTLED
                    && !Objects.equals(reservation.getActualAmount(), actualAmount)) {
                log.warn("Repeated settle for reservation {} with actual {} differs from recorded {}",
                        reservationId, actualAmount, reservation.getActualAmount());
            }
            return recordedSettlement(reservation);
        }

        Workspace workspace = lockWorkspace(reservation.getWorkspaceId());
        LocalDateTime now = LocalDateTime.now(clock);

        long estimate = reservation.getEstimatedAmount();
        long cap = estimate + billingProperties.getOverrunAllowance();
        long withinEstimate = Math.min(actualAmount, estimate);
        // Usage above the estimate but inside the allowance is drawn from the spendable balance
        long overrunRequested = Math.max(0L, Math.min(actualAmount, cap) - estimate);
        long overrunCharged = Math.min(overrunRequested, workspace.getBalance());
        long charged = withinEstimate + overrunCharged;
        long refund = estimate - withinEstimate;
        long absorbed = actualAmount - charged;

        workspace.setReserved(workspace.getReserved() - estimate);
        workspace.setBalance(workspace.getBalance() + refund - overrunCharged);
        workspace.setTotalCharged(workspace.getTotalCharged() + charged);
        workspace.setUpdatedAt(now);
        verifyIntegrity(workspace, "settle");

        CreditTransaction tx = newTransaction(workspace, CreditTransactionType.SETTLE,
                CreditTransactionSource.ORCHESTRATOR, -charged, now);
        tx.setUnits(actualAmount);
        tx.setRefundAmount(refund);
        tx.setReservationId(reservation.getId());
        tx.setRelatedRequestId(reservation.getRequestId());
        tx.setIdempotencyKey("settle:" + reservation.getId());
        tx.setServiceType(reservation.getServiceType());
        tx.setModel(reservation.getModel());
        tx.setProvider(reservation.getProvider());
        tx.setPeriodStart(workspace.getBillingPeriodStart());
        tx.setDescription(refund > 0
                ? "Settled " + charged + " credits, refunded " + refund
                : "Settled " + charged + " credits");
        tx.setMetaJson(buildMetaJson(Map.of(
                "estimated", estimate,
                "actual", actualAmount,
                "overrunCharged", overrunCharged)));
        tx = appendTransaction(tx, reservation.getId().toString());

        if (absorbed > 0) {
            CreditTransaction adjustment = newTransaction(workspace, CreditTransactionType.ADJUSTMENT,
                    CreditTransactionSource.ORCHESTRATOR, 0L, now);
            adjustment.setUnits(absorbed);
            adjustment.setReservationId(reservation.getId());
            adjustment.setRelatedRequestId(reservation.getRequestId());
            adjustment.setIdempotencyKey("overrun:" + reservation.getId());
            adjustment.setPeriodStart(workspace.getBillingPeriodStart());
            adjustment.setDescription("Usage beyond overrun allowance absorbed; flagged for review");
            adjustment.setMetaJson(buildMetaJson(Map.of(
                    "reason", "overrun",
                    "estimated", estimate,
                    "actual", actualAmount,
                    "allowance", billingProperties.getOverrunAllowance())));
            appendTransaction(adjustment, reservation.getId().toString());
            log.warn("Reservation {} overran its cap: actual={} cap={} absorbed={}",
                    reservation.getId(), actualAmount, cap, absorbed);
            metricsService.recordOverrunAbsorbed(workspace.getId(), absorbed);
        }

        reservation.setState(ReservationState.SETTLED);
        reservation.setActualAmount(actualAmount);
        reservation.setChargedAmount(charged);
        reservation.setRefundAmount(refund);
        reservation.setAbsorbedAmount(absorbed);
        reservation.setCompletedAt(now);
        reservation.setTerminalTransactionId(tx.getId());
        reservationRepository.save(reservation);

        eventPublisher.publishEvent(new CreditsSettledEvent(this, workspace.getId(), reservation.getId(),
                workspace.getBillingPeriodStart(), reservation.getServiceType(), reservation.getModel(),
                reservation.getProvider(), charged, actualAmount, absorbed));

        BillingStructuredLogger.logReservationOperation(log, "info",
                "Settled reservation {}: charged={} refund={} absorbed={}",
                workspace.getId(), "SETTLE", charged, reservation.getId(),
                reservation.getId(), charged, refund, absorbed);
        metricsService.incrementReservationSettled(workspace.getId(), charged, refund);

        return new SettlementResultDto(reservation.getId(), workspace.getId(), TerminalOutcome.SETTLED,
                estimate, actualAmount, charged, refund, absorbed, tx.getId());
    }

    private SettlementResultDto recordedSettlement(Reservation reservation) {
        if (reservation.getState() == ReservationState.RELEASED) {
            return new SettlementResultDto(reservation.getId(), reservation.getWorkspaceId(),
                    TerminalOutcome.ALREADY_RELEASED, reservation.getEstimatedAmount(),
                    0L, 0L, 0L, 0L, reservation.getTerminalTransactionId());
        }
        return new SettlementResultDto(reservation.getId(), reservation.getWorkspaceId(),
                TerminalOutcome.ALREADY_SETTLED, reservation.getEstimatedAmount(),
                valueOrZero(reservation.getActualAmount()),
                valueOrZero(reservation.getChargedAmount()),
                valueOrZero(reservation.getRefundAmount()),
                valueOrZero(reservation.getAbsorbedAmount()),
                reservation.getTerminalTransactionId());
    }

    @Override
    public ReleaseResultDto release(UUID reservationId, String reason) {
        return ledgerWriteExecutor.execute("release",
                () -> performRelease(reservationId, reason, CreditTransactionSource.ORCHESTRATOR));
    }

    private ReleaseResultDto performRelease(UUID reservationId, String reason, CreditTransactionSource source) {
        Reservation reservation = reservationRepository.findByIdForUpdate(reservationId).orElse(null);
        if (reservation == null) {
            log.warn("Release for unknown reservation {} ignored", reservationId);
            return ReleaseResultDto.notFound(reservationId);
        }
        if (reservation.getState() == ReservationState.RELEASED) {
            return new ReleaseResultDto(reservation.getId(), reservation.getWorkspaceId(),
                    TerminalOutcome.ALREADY_RELEASED, reservation.getEstimatedAmount(),
                    reservation.getReleaseReason(), reservation.getTerminalTransactionId());
        }
        if (reservation.getState() == ReservationState.SETTLED) {
            log.info("Release for reservation {} ignored: already settled", reservationId);
            return new ReleaseResultDto(reservation.getId(), reservation.getWorkspaceId(),
                    TerminalOutcome.ALREADY_SETTLED, 0L, null, reservation.getTerminalTransactionId());
        }

        Workspace workspace = lockWorkspace(reservation.getWorkspaceId());
        LocalDateTime now = LocalDateTime.now(clock);
        long estimate = reservation.getEstimatedAmount();
        String effectiveReason = reason == null || reason.isBlank() ? "released" : reason.trim();

        workspace.setReserved(workspace.getReserved() - estimate);
        workspace.setBalance(workspace.getBalance() + estimate);
        workspace.setUpdatedAt(now);
        verifyIntegrity(workspace, "release");

        CreditTransaction tx = newTransaction(workspace, CreditTransactionType.RELEASE, source, estimate, now);
        tx.setReservationId(reservation.getId());
        tx.setRelatedRequestId(reservation.getRequestId());
        tx.setIdempotencyKey("release:" + reservation.getId());
        tx.setDescription("Released hold: " + effectiveReason);
        tx.setMetaJson(buildMetaJson(Map.of("reason", effectiveReason, "released", estimate)));
        tx = appendTransaction(tx, reservation.getId().toString());

        reservation.setState(ReservationState.RELEASED);
        reservation.setReleaseReason(effectiveReason);
        reservation.setCompletedAt(now);
        reservation.setTerminalTransactionId(tx.getId());
        reservationRepository.save(reservation);

        BillingStructuredLogger.logReservationOperation(log, "info",
                "Released reservation {} ({} credits): {}",
                workspace.getId(), "RELEASE", estimate, reservation.getId(),
                reservation.getId(), estimate, effectiveReason);
        metricsService.incrementReservationReleased(workspace.getId(), estimate, effectiveReason);

        return new ReleaseResultDto(reservation.getId(), workspace.getId(), TerminalOutcome.RELEASED,
                estimate, effectiveReason, tx.getId());
    }

    @Override
    public TransactionDto creditPurchase(UUID workspaceId, long credits, String idempotencyKey, String reference) {
        requireAmountInRange(credits, 1L, "credits");
        requireIdempotencyKey(idempotencyKey);
        try {
            return ledgerWriteExecutor.execute("purchase", () -> {
                Workspace workspace = lockWorkspace(workspaceId);
                Optional<CreditTransaction> existing = transactionRepository.findByIdempotencyKey(idempotencyKey);
                if (existing.isPresent()) {
                    return transactionMapper.toDto(requireSameGrant(existing.get(), workspaceId,
                            CreditTransactionType.PURCHASE, credits));
                }
                LocalDateTime now = LocalDateTime.now(clock);
                workspace.setBalance(workspace.getBalance() + credits);
                workspace.setTotalGranted(workspace.getTotalGranted() + credits);
                workspace.setUpdatedAt(now);
                verifyIntegrity(workspace, "purchase");

                CreditTransaction tx = newTransaction(workspace, CreditTransactionType.PURCHASE,
                        CreditTransactionSource.CHECKOUT, credits, now);
                tx.setIdempotencyKey(idempotencyKey);
                tx.setRelatedRequestId(reference);
                tx.setDescription("Purchased " + credits + " credits");
                tx.setMetaJson(buildMetaJson(reference == null ? Map.of() : Map.of("ref", reference)));
                tx = appendTransaction(tx, reference);
                metricsService.incrementCreditsGranted(workspaceId, credits, CreditTransactionSource.CHECKOUT.name());
                return transactionMapper.toDto(tx);
            });
        } catch (DataIntegrityViolationException ex) {
            return transactionMapper.toDto(requireSameGrant(lookupAfterDuplicate(idempotencyKey, ex), workspaceId,
                    CreditTransactionType.PURCHASE, credits));
        }
    }

    @Override
    public TransactionDto creditAdjustment(UUID workspaceId, long credits, String idempotencyKey, String reason) {
        if (credits == 0) {
            throw new IllegalArgumentException("credits must not be zero");
        }
        requireAmountInRange(Math.abs(credits), 1L, "credits");
        requireIdempotencyKey(idempotencyKey);
        try {
            return ledgerWriteExecutor.execute("adjustment", () -> {
                Workspace workspace = lockWorkspace(workspaceId);
                Optional<CreditTransaction> existing = transactionRepository.findByIdempotencyKey(idempotencyKey);
                if (existing.isPresent()) {
                    return transactionMapper.toDto(requireSameGrant(existing.get(), workspaceId,
                            CreditTransactionType.ADJUSTMENT, credits));
                }
                if (credits < 0 && workspace.getBalance() < -credits) {
                    throw new InsufficientCreditsException(workspaceId, -credits, workspace.getBalance());
                }
                LocalDateTime now = LocalDateTime.now(clock);
                workspace.setBalance(workspace.getBalance() + credits);
                if (credits > 0) {
                    workspace.setTotalGranted(workspace.getTotalGranted() + credits);
                } else {
                    workspace.setTotalCharged(workspace.getTotalCharged() - credits);
                }
                workspace.setUpdatedAt(now);
                verifyIntegrity(workspace, "adjustment");

                CreditTransaction tx = newTransaction(workspace, CreditTransactionType.ADJUSTMENT,
                        CreditTransactionSource.ADMIN, credits, now);
                tx.setIdempotencyKey(idempotencyKey);
                tx.setDescription(reason);
                tx.setMetaJson(buildMetaJson(Map.of("reason", reason == null ? "" : reason)));
                tx = appendTransaction(tx, null);
                metricsService.incrementCreditsAdjusted(workspaceId, credits);
                return transactionMapper.toDto(tx);
            });
        } catch (DataIntegrityViolationException ex) {
            return transactionMapper.toDto(requireSameGrant(lookupAfterDuplicate(idempotencyKey, ex), workspaceId,
                    CreditTransactionType.ADJUSTMENT, credits));
        }
    }

    @Override
    public BalanceDto startBillingPeriod(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        Objects.requireNonNull(periodStart, "periodStart must not be null");
        Objects.requireNonNull(periodEnd, "periodEnd must not be null");
        if (!periodEnd.isAfter(periodStart)) {
            throw new IllegalArgumentException("periodEnd must be after periodStart");
        }
        return ledgerWriteExecutor.execute("allotment", () -> {
            Workspace workspace = lockWorkspace(workspaceId);
            if (workspace.getBillingPeriodStart() != null && periodStart.isBefore(workspace.getBillingPeriodStart())) {
                throw new IllegalArgumentException("Billing period " + periodStart
                        + " starts before the current period " + workspace.getBillingPeriodStart());
            }
            LocalDateTime now = LocalDateTime.now(clock);
            workspace.setBillingPeriodStart(periodStart);
            workspace.setBillingPeriodEnd(periodEnd);
            workspace.setUpdatedAt(now);

            String key = "allotment:" + workspaceId + ":" + periodStart;
            long allotment = workspace.getPlan().getAllotmentCredits();
            if (allotment > 0 && transactionRepository.findByIdempotencyKey(key).isEmpty()) {
                workspace.setBalance(workspace.getBalance() + allotment);
                workspace.setTotalGranted(workspace.getTotalGranted() + allotment);
                verifyIntegrity(workspace, "allotment");

                CreditTransaction tx = newTransaction(workspace, CreditTransactionType.ALLOTMENT,
                        CreditTransactionSource.PLAN, allotment, now);
                tx.setIdempotencyKey(key);
                tx.setPeriodStart(periodStart);
                tx.setDescription("Plan " + workspace.getPlan().getCode() + " allotment for period starting " + periodStart);
                appendTransaction(tx, workspace.getPlan().getCode());
                metricsService.incrementCreditsGranted(workspaceId, allotment, CreditTransactionSource.PLAN.name());
            }
            log.info("Workspace {} billing period set to [{}, {})", workspaceId, periodStart, periodEnd);
            return balanceMapper.toDto(workspace);
        });
    }

    @Override
    public Optional<TransactionDto> recordOverageCharge(UUID workspaceId, LocalDateTime periodStart,
                                                        LocalDateTime periodEnd, long overageUnitsToDate,
                                                        LongFunction<String> describer) {
        requireAmountInRange(overageUnitsToDate, 1L, "overageUnitsToDate");
        String periodKey = overagePeriodKey(workspaceId, periodStart, periodEnd);
        return ledgerWriteExecutor.execute("overage", () -> {
            Workspace workspace = lockWorkspace(workspaceId);
            long recorded = overageEntries(workspaceId, periodStart, periodKey).stream()
                    .mapToLong(tx -> valueOrZero(tx.getUnits()))
                    .sum();
            long units = overageUnitsToDate - recorded;
            if (units <= 0) {
                log.debug("Overage for workspace {} period key {} already recorded through {} units",
                        workspaceId, periodKey, recorded);
                return Optional.<TransactionDto>empty();
            }
            String key = recorded == 0 ? periodKey : periodKey + ":through:" + overageUnitsToDate;
            verifyIntegrity(workspace, "overage");
            LocalDateTime now = LocalDateTime.now(clock);
            // Overage is billed in money; the balance is untouched
            CreditTransaction tx = newTransaction(workspace, CreditTransactionType.OVERAGE_CHARGE,
                    CreditTransactionSource.OVERAGE, 0L, now);
            tx.setUnits(units);
            tx.setIdempotencyKey(key);
            tx.setPeriodStart(periodStart);
            tx.setDescription(describer.apply(units));
            tx.setMetaJson(buildMetaJson(Map.of(
                    "periodStart", periodStart.toString(),
                    "periodEnd", periodEnd.toString(),
                    "overageUnitsToDate", overageUnitsToDate)));
            tx = appendTransaction(tx, key);
            eventPublisher.publishEvent(new OverageChargedEvent(this, workspaceId, periodStart, units));
            return Optional.of(transactionMapper.toDto(tx));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<TransactionDto> listOverageEntries(UUID workspaceId, LocalDateTime periodStart,
                                                   LocalDateTime periodEnd) {
        return overageEntries(workspaceId, periodStart, overagePeriodKey(workspaceId, periodStart, periodEnd)).stream()
                .map(transactionMapper::toDto)
                .toList();
    }

    /**
     * Entries whose key belongs to this exact period. Keys of a longer period can share the prefix,
     * so matching is on the full key or the supplementary-entry suffix.
     */
    private List<CreditTransaction> overageEntries(UUID workspaceId, LocalDateTime periodStart, String periodKey) {
        String supplementPrefix = periodKey + ":through:";
        return transactionRepository.findByWorkspaceIdAndPeriodStartAndTypeIn(workspaceId, periodStart,
                        EnumSet.of(CreditTransactionType.OVERAGE_CHARGE)).stream()
                .filter(tx -> periodKey.equals(tx.getIdempotencyKey())
                        || (tx.getIdempotencyKey() != null && tx.getIdempotencyKey().startsWith(supplementPrefix)))
                .sorted(Comparator.comparing(CreditTransaction::getCreatedAt))
                .toList();
    }

    private static String overagePeriodKey(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        return "overage:" + workspaceId + ":" + periodStart + ":" + periodEnd;
    }

    @Override
    @Scheduled(fixedDelayString = "${billing.reservation-sweeper-ms:60000}",
            initialDelayString = "${billing.reservation-sweeper-initial-delay-ms:30000}")
    public int expireReservations() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<UUID> expired = reservationRepository.findIdsByStateAndExpiresAtBefore(
                ReservationState.HELD, now, PageRequest.of(0, billingProperties.getSweeperBatchSize()));
        metricsService.recordSweeperBacklog(expired.size());
        if (expired.isEmpty()) {
            return 0;
        }
        log.info("Sweeper found {} expired reservations", expired.size());

        int released = 0;
        for (UUID reservationId : expired) {
            try {
                ReleaseResultDto result = ledgerWriteExecutor.execute("expire",
                        () -> performRelease(reservationId, EXPIRED_REASON, CreditTransactionSource.SWEEPER));
                if (result.outcome() == TerminalOutcome.RELEASED) {
                    released++;
                    metricsService.incrementReservationExpired(result.workspaceId(), result.releasedAmount());
                }
            } catch (RuntimeException ex) {
                // Next run picks the reservation up again
                log.error("Failed to expire reservation {}: {}", reservationId, ex.getMessage(), ex);
            }
        }
        return released;
    }

    private Workspace lockWorkspace(UUID workspaceId) {
        return workspaceRepository.findByIdForUpdate(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
    }

    private CreditTransaction newTransaction(Workspace workspace, CreditTransactionType type,
                                             CreditTransactionSource source, long amount, LocalDateTime now) {
        CreditTransaction tx = new CreditTransaction();
        tx.setWorkspaceId(workspace.getId());
        tx.setType(type);
        tx.setSource(source);
        tx.setAmount(amount);
        tx.setBalanceAfter(workspace.getBalance());
        tx.setReservedAfter(workspace.getReserved());
        tx.setCreatedAt(now);
        return tx;
    }

    private CreditTransaction appendTransaction(CreditTransaction tx, String refId) {
        CreditTransaction saved = transactionRepository.save(tx);
        BillingStructuredLogger.logLedgerWrite(log, "info", "Ledger {} {} for workspace {}",
                saved.getWorkspaceId(), saved.getType().name(), saved.getSource().name(), saved.getAmount(),
                saved.getIdempotencyKey(), valueOrZero(saved.getBalanceAfter()), valueOrZero(saved.getReservedAfter()),
                refId, saved.getType(), saved.getAmount(), saved.getWorkspaceId());
        return saved;
    }

    /**
     * Both counters and both buckets must agree before anything is flushed; a mismatch aborts the transaction.
     */
    private void verifyIntegrity(Workspace workspace, String operation) {
        if (workspace.getBalance() < 0 || workspace.getReserved() < 0) {
            log.error("Integrity violation in {} for workspace {}: balance={} reserved={}",
                    operation, workspace.getId(), workspace.getBalance(), workspace.getReserved());
            throw new LedgerIntegrityException("Negative balance or reserved credits for workspace "
                    + workspace.getId() + " during " + operation);
        }
        long held = workspace.getBalance() + workspace.getReserved();
        long expected = workspace.getTotalGranted() - workspace.getTotalCharged();
        if (held != expected) {
            log.error("Conservation violation in {} for workspace {}: balance+reserved={} granted-charged={}",
                    operation, workspace.getId(), held, expected);
            throw new LedgerIntegrityException("Conservation check failed for workspace "
                    + workspace.getId() + " during " + operation);
        }
    }

    private CreditTransaction requireSameGrant(CreditTransaction existing, UUID workspaceId,
                                               CreditTransactionType type, long amount) {
        if (!existing.getWorkspaceId().equals(workspaceId) || existing.getType() != type || existing.getAmount() != amount) {
            throw new IdempotencyConflictException("Idempotency key " + existing.getIdempotencyKey()
                    + " was already used for a different ledger entry");
        }
        return existing;
    }

    private CreditTransaction lookupAfterDuplicate(String idempotencyKey, DataIntegrityViolationException ex) {
        return transactionRepository.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> ex);
    }

    private static void requireAmountInRange(long amount, long min, String field) {
        if (amount < min || amount > MAX_CREDITS) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + MAX_CREDITS);
        }
    }

    private static void requireIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("idempotencyKey is required");
        }
    }

    private static long valueOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private String buildMetaJson(Map<String, Object> values) {
        if (values.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(new LinkedHashMap<>(values));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise ledger metadata: {}", e.getMessage());
            return null;
        }
    }
}
