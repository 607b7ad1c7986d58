package uk.gegc.creditledger.features.billing.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.creditledger.features.billing.api.dto.BalanceDto;
import uk.gegc.creditledger.features.billing.api.dto.ReleaseResultDto;
import uk.gegc.creditledger.features.billing.api.dto.ReservationDto;
import uk.gegc.creditledger.features.billing.api.dto.ReserveRequest;
import uk.gegc.creditledger.features.billing.api.dto.SettlementResultDto;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.LongFunction;

/**
 * Credit ledger for workspaces: balance reads, reservation lifecycle, grants and adjustments.
 * Every mutation runs as one atomic read-modify-write on the workspace row and appends
 * to the transaction ledger in the same database transaction.
 */
public interface BillingService {

    BalanceDto getBalance(UUID workspaceId);

    Page<TransactionDto> listTransactions(UUID workspaceId, Pageable pageable,
                                          CreditTransactionType type,
                                          LocalDateTime dateFrom, LocalDateTime dateTo);

    /**
     * Places a hold of the estimated credits. Retries with the same request id return the existing reservation.
     *
     * @throws uk.gegc.creditledger.features.billing.domain.exception.InsufficientCreditsException
     *         if the spendable balance is below the estimate; nothing is written in that case
     */
    ReservationDto reserve(ReserveRequest request);

    ReservationDto getReservation(UUID reservationId);

    /**
     * Converts a held reservation into a charge for the actual usage and refunds the unused part
     * of the estimate. Unknown or already terminal reservations return their recorded outcome.
     */
    SettlementResultDto settle(UUID reservationId, long actualAmount);

    /**
     * Returns the full estimate of a held reservation to the balance.
     * Unknown or already terminal reservations return their recorded outcome.
     */
    ReleaseResultDto release(UUID reservationId, String reason);

    TransactionDto creditPurchase(UUID workspaceId, long credits, String idempotencyKey, String reference);

    /**
     * Admin correction. Positive values grant credits; negative values remove spendable credits
     * and never take the balance below zero.
     */
    TransactionDto creditAdjustment(UUID workspaceId, long credits, String idempotencyKey, String reason);

    /**
     * Moves the workspace into a new billing period and grants the plan allotment for it once.
     */
    BalanceDto startBillingPeriod(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd);

    /**
     * Brings the period's OVERAGE_CHARGE entries up to {@code overageUnitsToDate}. The first entry of a
     * period covers everything above the limit at that point; later calls append one entry for the units
     * not yet recorded. Serialised on the workspace row, so concurrent calls never record a unit twice.
     *
     * @param describer ledger description for the units the new entry records
     * @return the new entry, or empty when the ledger already covers {@code overageUnitsToDate}
     */
    Optional<TransactionDto> recordOverageCharge(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd,
                                                 long overageUnitsToDate, LongFunction<String> describer);

    /**
     * OVERAGE_CHARGE entries recorded for exactly this period, oldest first.
     */
    List<TransactionDto> listOverageEntries(UUID workspaceId, LocalDateTime periodStart, LocalDateTime periodEnd);

    /**
     * Releases held reservations whose TTL has passed.
     *
     * @return number of reservations this run released
     */
    int expireReservations();
}
