package uk.gegc.creditledger.features.overage.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.application.BillingProperties;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.overage.api.dto.OverageResultDto;
import uk.gegc.creditledger.features.overage.application.InvoiceCollaborator;
import uk.gegc.creditledger.features.overage.application.InvoiceCollaborator.InvoiceItemRequest;
import uk.gegc.creditledger.features.overage.application.OverageProperties;
import uk.gegc.creditledger.features.overage.application.OverageService;
import uk.gegc.creditledger.features.overage.domain.event.OverageRecordedEvent;
import uk.gegc.creditledger.features.overage.domain.exception.InvoiceCollaboratorUnavailableException;
import uk.gegc.creditledger.features.overage.domain.model.OverageCharge;
import uk.gegc.creditledger.features.overage.domain.model.OverageStatus;
import uk.gegc.creditledger.features.overage.infra.repository.OverageChargeRepository;
import uk.gegc.creditledger.features.usage.application.UsageAggregationService;
import uk.gegc.creditledger.features.workspace.domain.exception.WorkspaceNotFoundException;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class OverageServiceImpl implements OverageService {

    private final WorkspaceRepository workspaceRepository;
    private final OverageChargeRepository chargeRepository;
    private final UsageAggregationService usageAggregationService;
    private final BillingService billingService;
    private final InvoiceCollaborator invoiceCollaborator;
    private final OverageProperties overageProperties;
    private final BillingProperties billingProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final Counter evaluationsCounter;
    private final Counter invoiceFailuresCounter;

    public OverageServiceImpl(WorkspaceRepository workspaceRepository,
                              OverageChargeRepository chargeRepository,
                              UsageAggregationService usageAggregationService,
                              BillingService billingService,
                              InvoiceCollaborator invoiceCollaborator,
                              OverageProperties overageProperties,
                              BillingProperties billingProperties,
                              ApplicationEventPublisher eventPublisher,
                              PlatformTransactionManager transactionManager,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.workspaceRepository = workspaceRepository;
        this.chargeRepository = chargeRepository;
        this.usageAggregationService = usageAggregationService;
        this.billingService = billingService;
        this.invoiceCollaborator = invoiceCollaborator;
        this.overageProperties = overageProperties;
        this.billingProperties = billingProperties;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.evaluationsCounter = Counter.builder("overage.evaluations")
                .description("Overage evaluations run")
                .register(meterRegistry);
        this.invoiceFailuresCounter = Counter.builder("overage.invoice.failures")
                .description("Invoice item requests the collaborator did not accept")
                .register(meterRegistry);
    }

    @Override
    public OverageResultDto evaluate(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        if (periodStart == null || periodEnd == null || !periodEnd.isAfter(periodStart)) {
            throw new IllegalArgumentException("periodEnd must be after periodStart");
        }
        evaluationsCounter.increment();
        Workspace workspace = workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));

        Computation computation = compute(workspace, periodStart);
        if (computation.status == null) {
            long billed = lastCharge(chargesFor(workspaceId, periodStart, periodEnd))
                    .map(OverageCharge::getOverageUnitsToDate)
                    .orElse(0L);
            long unbilled = computation.overageUnits - billed;
            if (unbilled > 0 && chargeFor(unbilled, computation.rate).signum() > 0) {
                BigDecimal rate = computation.rate;
                billingService.recordOverageCharge(workspaceId, periodStart, periodEnd, computation.overageUnits,
                        units -> describe(units, rate));
            } else if (unbilled > 0) {
                log.debug("Unbilled overage of {} units for workspace {} rounds to no charge; deferred",
                        unbilled, workspaceId);
            }
        }

        List<OverageCharge> charges = recordMissingCharges(workspace, periodStart, periodEnd, computation);
        if (charges.isEmpty()) {
            return computation.toResult(workspaceId, periodStart, periodEnd);
        }
        for (OverageCharge charge : charges) {
            if (charge.getStatus() == OverageStatus.PENDING) {
                submitInvoice(charge.getId());
            }
        }
        return summarize(computation, workspaceId, periodStart, periodEnd,
                chargesFor(workspaceId, periodStart, periodEnd));
    }

    @Override
    public OverageResultDto evaluateCurrentPeriod(UUID workspaceId) {
        Workspace workspace = workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
        return evaluate(workspaceId, workspace.getBillingPeriodStart(), workspace.getBillingPeriodEnd());
    }

    @Override
    public OverageResultDto preview(UUID workspaceId) {
        Workspace workspace = workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));
        LocalDateTime periodStart = workspace.getBillingPeriodStart();
        LocalDateTime periodEnd = workspace.getBillingPeriodEnd();

        Computation computation = compute(workspace, periodStart);
        if (computation.status != null) {
            return computation.toResult(workspaceId, periodStart, periodEnd);
        }
        return new OverageResultDto(workspaceId, periodStart, periodEnd, OverageStatus.PREVIEW,
                computation.usage, computation.limit, computation.overageUnits, computation.rate,
                computation.charge, billingProperties.getCurrency(), idempotencyKey(workspaceId, periodStart, periodEnd),
                null, null);
    }

    @Override
    public List<OverageResultDto> listCharges(UUID workspaceId) {
        if (!workspaceRepository.existsById(workspaceId)) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        return chargeRepository.findByWorkspaceIdOrderByPeriodStartDescOverageUnitsToDateAsc(workspaceId).stream()
                .map(this::toDto)
                .toList();
    }

    @Override
    @Scheduled(fixedDelayString = "${billing.overage.retry-delay-ms:300000}",
            initialDelayString = "${billing.overage.retry-initial-delay-ms:60000}")
    public int retryPendingInvoices() {
        List<UUID> due = chargeRepository.findIdsDueForSubmission(OverageStatus.PENDING, OverageStatus.SUBMITTING,
                staleClaimCutoff(), overageProperties.getMaxInvoiceAttempts(),
                PageRequest.of(0, overageProperties.getRetryBatchSize()));
        if (due.isEmpty()) {
            return 0;
        }
        log.info("Retrying {} pending overage invoice items", due.size());
        int invoiced = 0;
        for (UUID chargeId : due) {
            try {
                if (submitInvoice(chargeId).getStatus() == OverageStatus.INVOICED) {
                    invoiced++;
                }
            } catch (RuntimeException ex) {
                log.error("Failed to retry invoice item for overage charge {}", chargeId, ex);
            }
        }
        return invoiced;
    }

    private Computation compute(Workspace workspace, LocalDateTime periodStart) {
        Computation computation = new Computation();
        computation.usage = usageAggregationService.getCreditsCharged(workspace.getId(), periodStart);
        computation.limit = workspace.effectiveCreditLimit();
        BigDecimal rate = workspace.effectiveOverageRate();
        computation.rate = rate != null ? rate : overageProperties.getDefaultRate();
        if (computation.limit == null) {
            computation.status = OverageStatus.UNLIMITED;
            computation.charge = BigDecimal.ZERO.setScale(2);
            return computation;
        }
        computation.overageUnits = Math.max(0L, computation.usage - computation.limit);
        computation.charge = chargeFor(computation.overageUnits, computation.rate);
        if (computation.charge.signum() == 0) {
            computation.status = OverageStatus.WITHIN_LIMIT;
        }
        return computation;
    }

    private List<OverageCharge> chargesFor(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        return chargeRepository.findByWorkspaceIdAndPeriodStartAndPeriodEndOrderByOverageUnitsToDateAsc(
                workspaceId, periodStart, periodEnd);
    }

    private static Optional<OverageCharge> lastCharge(List<OverageCharge> charges) {
        return charges.isEmpty() ? Optional.empty() : Optional.of(charges.get(charges.size() - 1));
    }

    /**
     * Gives every OVERAGE_CHARGE ledger entry of the period its money-side row. Covers entries written by
     * this evaluation and entries whose row an interrupted or concurrent evaluation never got to write.
     */
    private List<OverageCharge> recordMissingCharges(Workspace workspace, LocalDateTime periodStart,
                                                     LocalDateTime periodEnd, Computation computation) {
        List<TransactionDto> entries = billingService.listOverageEntries(workspace.getId(), periodStart, periodEnd);
        long unitsToDate = 0;
        for (TransactionDto entry : entries) {
            long units = entry.units() != null ? entry.units() : 0L;
            unitsToDate += units;
            if (chargeRepository.findByIdempotencyKey(entry.idempotencyKey()).isEmpty()) {
                recordCharge(workspace, periodStart, periodEnd, computation, entry, units, unitsToDate);
            }
        }
        return chargesFor(workspace.getId(), periodStart, periodEnd);
    }

    private void recordCharge(Workspace workspace, LocalDateTime periodStart, LocalDateTime periodEnd,
                              Computation computation, TransactionDto ledgerEntry, long units, long unitsToDate) {
        BigDecimal charge = chargeFor(units, computation.rate);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                OverageCharge row = new OverageCharge();
                row.setWorkspaceId(workspace.getId());
                row.setPeriodStart(periodStart);
                row.setPeriodEnd(periodEnd);
                row.setUsageCredits(computation.usage);
                row.setCreditLimit(computation.limit != null ? computation.limit : 0L);
                row.setOverageUnits(units);
                row.setOverageUnitsToDate(unitsToDate);
                row.setRate(computation.rate);
                row.setCharge(charge);
                row.setAmountCents(charge.movePointRight(2).longValueExact());
                row.setCurrency(billingProperties.getCurrency());
                row.setIdempotencyKey(ledgerEntry.idempotencyKey());
                row.setLedgerTransactionId(ledgerEntry.id());
                row.setStatus(StringUtils.hasText(workspace.getStripeCustomerId())
                        ? OverageStatus.PENDING
                        : OverageStatus.NO_BILLING_CUSTOMER);
                row.setCreatedAt(LocalDateTime.now(clock));
                OverageCharge saved = chargeRepository.saveAndFlush(row);

                if (saved.getStatus() == OverageStatus.NO_BILLING_CUSTOMER) {
                    log.warn("Workspace {} has overage of {} {} but no billing customer; recorded without invoicing",
                            workspace.getId(), charge, saved.getCurrency());
                }
                log.info("Recorded overage for workspace {} period [{}, {}): units={} toDate={} rate={} charge={} {}",
                        workspace.getId(), periodStart, periodEnd, units, unitsToDate, computation.rate, charge,
                        saved.getCurrency());
                if (overageProperties.isNotifyOwner()) {
                    eventPublisher.publishEvent(new OverageRecordedEvent(this, workspace.getId(), workspace.getName(),
                            workspace.getOwnerEmail(), computation.usage, row.getCreditLimit(), charge,
                            saved.getCurrency()));
                }
            });
        } catch (DataIntegrityViolationException ex) {
            // Another evaluation wrote the row for this ledger entry first
            log.info("Overage charge {} for workspace {} recorded concurrently", ledgerEntry.idempotencyKey(),
                    workspace.getId());
        }
    }

    /**
     * Sends the invoice item for a pending charge. Only the caller that wins the claim talks to the
     * collaborator; failures put the charge back to PENDING for the retry job.
     */
    private OverageCharge submitInvoice(UUID chargeId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Integer claimed = transactionTemplate.execute(status -> chargeRepository.claimForSubmission(chargeId,
                OverageStatus.PENDING, OverageStatus.SUBMITTING, now, staleClaimCutoff()));
        OverageCharge charge = chargeRepository.findById(chargeId).orElseThrow();
        if (claimed == null || claimed == 0) {
            log.debug("Overage charge {} not claimed; status {}", chargeId, charge.getStatus());
            return charge;
        }
        String customerId = workspaceRepository.findById(charge.getWorkspaceId())
                .map(Workspace::getStripeCustomerId)
                .orElse(null);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("workspaceId", charge.getWorkspaceId().toString());
        metadata.put("periodStart", charge.getPeriodStart().toString());
        metadata.put("periodEnd", charge.getPeriodEnd().toString());
        metadata.put("overageUnits", String.valueOf(charge.getOverageUnits()));
        metadata.put("overageUnitsToDate", String.valueOf(charge.getOverageUnitsToDate()));
        metadata.put("rate", charge.getRate().stripTrailingZeros().toPlainString());

        String invoiceItemId = null;
        String error = null;
        try {
            invoiceItemId = invoiceCollaborator.createInvoiceItem(new InvoiceItemRequest(
                    customerId, charge.getAmountCents(), charge.getCurrency(),
                    describe(charge.getOverageUnits(), charge.getRate()), charge.getIdempotencyKey(), metadata));
        } catch (InvoiceCollaboratorUnavailableException ex) {
            invoiceFailuresCounter.increment();
            error = truncate(ex.getMessage());
            log.warn("Invoice item for overage {} (workspace {}) not accepted on attempt {}: {}",
                    charge.getId(), charge.getWorkspaceId(), charge.getAttempts(), ex.getMessage());
        }
        return recordSubmissionOutcome(chargeId, invoiceItemId, error);
    }

    private OverageCharge recordSubmissionOutcome(UUID chargeId, String invoiceItemId, String error) {
        return transactionTemplate.execute(status -> {
            OverageCharge charge = chargeRepository.findById(chargeId).orElseThrow();
            if (invoiceItemId != null) {
                charge.setStatus(OverageStatus.INVOICED);
                charge.setInvoiceItemId(invoiceItemId);
                charge.setInvoicedAt(LocalDateTime.now(clock));
                charge.setLastError(null);
            } else {
                charge.setStatus(OverageStatus.PENDING);
                charge.setLastError(error);
            }
            charge.setClaimedAt(null);
            return chargeRepository.save(charge);
        });
    }

    private LocalDateTime staleClaimCutoff() {
        return LocalDateTime.now(clock).minusMinutes(overageProperties.getSubmissionTimeoutMinutes());
    }

    /**
     * Current-period figures with the state of what has been recorded. The status is the least settled
     * of the period's charges; ids and key are those of the latest charge.
     */
    private OverageResultDto summarize(Computation computation, UUID workspaceId, LocalDateTime periodStart,
                                       LocalDateTime periodEnd, List<OverageCharge> charges) {
        OverageCharge latest = charges.get(charges.size() - 1);
        OverageStatus status = latest.getStatus();
        for (OverageCharge charge : charges) {
            if (charge.getStatus() == OverageStatus.PENDING || charge.getStatus() == OverageStatus.SUBMITTING) {
                status = charge.getStatus();
                break;
            }
        }
        return new OverageResultDto(workspaceId, periodStart, periodEnd, status, computation.usage,
                computation.limit, computation.overageUnits, computation.rate, computation.charge,
                latest.getCurrency(), latest.getIdempotencyKey(), latest.getInvoiceItemId(),
                latest.getLedgerTransactionId());
    }

    private OverageResultDto toDto(OverageCharge charge) {
        return new OverageResultDto(charge.getWorkspaceId(), charge.getPeriodStart(), charge.getPeriodEnd(),
                charge.getStatus(), charge.getUsageCredits(), charge.getCreditLimit(), charge.getOverageUnits(),
                charge.getRate(), charge.getCharge(), charge.getCurrency(), charge.getIdempotencyKey(),
                charge.getInvoiceItemId(), charge.getLedgerTransactionId());
    }

    static BigDecimal chargeFor(long units, BigDecimal rate) {
        return BigDecimal.valueOf(units).multiply(rate).setScale(2, RoundingMode.HALF_UP);
    }

    static String describe(long units, BigDecimal rate) {
        return "Overage charges: " + units + " credits @ $" + rate.stripTrailingZeros().toPlainString() + " per credit";
    }

    static String idempotencyKey(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        return "overage:" + workspaceId + ":" + periodStart + ":" + periodEnd;
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 1000 ? message : message.substring(0, 1000);
    }

    private static final class Computation {
        private long usage;
        private Long limit;
        private long overageUnits;
        private BigDecimal rate;
        private BigDecimal charge;
        private OverageStatus status;

        private OverageResultDto toResult(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd) {
            return new OverageResultDto(workspaceId, periodStart, periodEnd, status, usage, limit, overageUnits,
                    rate, charge, null, null, null, null);
        }
    }
}
