package uk.gegc.creditledger.features.billing.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import uk.gegc.creditledger.BaseIntegrationTest;
import uk.gegc.creditledger.features.billing.api.dto.BalanceDto;
import uk.gegc.creditledger.features.billing.api.dto.ReleaseResultDto;
import uk.gegc.creditledger.features.billing.api.dto.ReservationDto;
import uk.gegc.creditledger.features.billing.api.dto.ReserveRequest;
import uk.gegc.creditledger.features.billing.api.dto.SettlementResultDto;
import uk.gegc.creditledger.features.billing.api.dto.TerminalOutcome;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.billing.domain.exception.IdempotencyConflictException;
import uk.gegc.creditledger.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransaction;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionSource;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;
import uk.gegc.creditledger.features.billing.domain.model.Reservation;
import uk.gegc.creditledger.features.billing.domain.model.ReservationState;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;
import uk.gegc.creditledger.features.billing.infra.repository.CreditTransactionRepository;
import uk.gegc.creditledger.features.billing.infra.repository.ReservationRepository;
import uk.gegc.creditledger.features.billing.testutils.LedgerAsserts;
import uk.gegc.creditledger.features.workspace.api.dto.WorkspaceDto;
import uk.gegc.creditledger.features.workspace.domain.exception.WorkspaceNotFoundException;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;
import uk.gegc.creditledger.features.workspace.infra.repository.WorkspaceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BillingService ledger operations")
class BillingServiceIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private BillingService billingService;
    @Autowired
    private WorkspaceRepository workspaceRepository;
    @Autowired
    private CreditTransactionRepository transactionRepository;
    @Autowired
    private ReservationRepository reservationRepository;
    @Autowired
    private Clock clock;

    private Workspace reload(UUID workspaceId) {
        return workspaceRepository.findById(workspaceId).orElseThrow();
    }

    private List<CreditTransaction> ledger(UUID workspaceId) {
        return transactionRepository.findByWorkspaceIdOrderByCreatedAtAsc(workspaceId);
    }

    private void assertLedgerInvariants(UUID workspaceId) {
        Workspace workspace = reload(workspaceId);
        LedgerAsserts.assertNonNegative(workspace);
        LedgerAsserts.assertConservation(workspace, ledger(workspaceId));
        LedgerAsserts.assertReservedMatchesHolds(workspace, reservationRepository.findAll());
    }

    @Nested
    @DisplayName("reserve")
    class Reserve {

        @Test
        @DisplayName("moves the estimate from balance to reserved and writes a RESERVE entry")
        void holdsEstimate() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);

            ReservationDto reservation = fixtures.reserve(ws.id(), 60);

            BalanceDto balance = billingService.getBalance(ws.id());
            assertThat(balance.balance()).isEqualTo(40L);
            assertThat(balance.reserved()).isEqualTo(60L);
            assertThat(reservation.state()).isEqualTo(ReservationState.HELD);
            assertThat(reservation.expiresAt()).isAfter(reservation.createdAt());

            List<CreditTransaction> entries = transactionRepository.findByReservationIdOrderByCreatedAtAsc(reservation.id());
            assertThat(entries).singleElement().satisfies(tx -> {
                assertThat(tx.getType()).isEqualTo(CreditTransactionType.RESERVE);
                assertThat(tx.getAmount()).isEqualTo(-60L);
                assertThat(tx.getBalanceAfter()).isEqualTo(40L);
                assertThat(tx.getReservedAfter()).isEqualTo(60L);
                assertThat(tx.getIdempotencyKey()).isEqualTo("reserve:" + reservation.requestId());
            });
            assertLedgerInvariants(ws.id());
        }

        @Test
        @DisplayName("rejects an estimate above the spendable balance without writing anything")
        void insufficientCredits() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(40);
            int entriesBefore = ledger(ws.id()).size();
            ReserveRequest request = new ReserveRequest(ws.id(), "req-" + UUID.randomUUID(), 60,
                    ServiceType.TEXT, "gpt-4o", "openai");

            assertThatThrownBy(() -> billingService.reserve(request))
                    .isInstanceOf(InsufficientCreditsException.class)
                    .satisfies(ex -> {
                        InsufficientCreditsException ice = (InsufficientCreditsException) ex;
                        assertThat(ice.getRequired()).isEqualTo(60L);
                        assertThat(ice.getAvailable()).isEqualTo(40L);
                        assertThat(ice.getShortfall()).isEqualTo(20L);
                    });

            assertThat(reservationRepository.findByRequestId(request.requestId())).isEmpty();
            assertThat(ledger(ws.id())).hasSize(entriesBefore);
            assertThat(reload(ws.id()).getBalance()).isEqualTo(40L);
        }

        @Test
        @DisplayName("a retried request id returns the original reservation")
        void replayReturnsExisting() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReserveRequest request = new ReserveRequest(ws.id(), "req-" + UUID.randomUUID(), 30,
                    ServiceType.TEXT, "gpt-4o", "openai");

            ReservationDto first = billingService.reserve(request);
            ReservationDto second = billingService.reserve(request);

            assertThat(second.id()).isEqualTo(first.id());
            assertThat(reload(ws.id()).getReserved()).isEqualTo(30L);
            assertThat(ledger(ws.id())).filteredOn(tx -> tx.getType() == CreditTransactionType.RESERVE).hasSize(1);
        }

        @Test
        @DisplayName("reusing a request id with a different estimate is a conflict")
        void replayWithDifferentEstimate() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            String requestId = "req-" + UUID.randomUUID();
            billingService.reserve(new ReserveRequest(ws.id(), requestId, 30, ServiceType.TEXT, "gpt-4o", "openai"));

            assertThatThrownBy(() -> billingService.reserve(
                    new ReserveRequest(ws.id(), requestId, 31, ServiceType.TEXT, "gpt-4o", "openai")))
                    .isInstanceOf(IdempotencyConflictException.class);
        }

        @Test
        void unknownWorkspace() {
            ReserveRequest request = new ReserveRequest(UUID.randomUUID(), "req-" + UUID.randomUUID(), 1,
                    ServiceType.TEXT, "gpt-4o", "openai");

            assertThatThrownBy(() -> billingService.reserve(request)).isInstanceOf(WorkspaceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("settle")
    class Settle {

        @Test
        @DisplayName("charges the actual usage and refunds the rest of the estimate")
        void refundsUnusedEstimate() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);

            SettlementResultDto result = billingService.settle(reservation.id(), 30);

            assertThat(result.outcome()).isEqualTo(TerminalOutcome.SETTLED);
            assertThat(result.chargedAmount()).isEqualTo(30L);
            assertThat(result.refundAmount()).isEqualTo(20L);
            assertThat(result.absorbedAmount()).isZero();

            Workspace workspace = reload(ws.id());
            assertThat(workspace.getBalance()).isEqualTo(70L);
            assertThat(workspace.getReserved()).isZero();

            List<CreditTransaction> entries = transactionRepository.findByReservationIdOrderByCreatedAtAsc(reservation.id());
            assertThat(entries).extracting(CreditTransaction::getType)
                    .containsExactly(CreditTransactionType.RESERVE, CreditTransactionType.SETTLE);
            CreditTransaction settle = entries.get(1);
            assertThat(settle.getAmount()).isEqualTo(-30L);
            assertThat(settle.getRefundAmount()).isEqualTo(20L);
            assertThat(settle.getUnits()).isEqualTo(30L);
            assertThat(settle.getPeriodStart()).isEqualTo(workspace.getBillingPeriodStart());
            assertThat(settle.getId()).isEqualTo(result.transactionId());
            assertLedgerInvariants(ws.id());
        }

        @Test
        @DisplayName("a second settle returns the recorded outcome and writes nothing")
        void idempotent() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);

            SettlementResultDto first = billingService.settle(reservation.id(), 30);
            SettlementResultDto second = billingService.settle(reservation.id(), 45);

            assertThat(second.outcome()).isEqualTo(TerminalOutcome.ALREADY_SETTLED);
            assertThat(second.chargedAmount()).isEqualTo(first.chargedAmount());
            assertThat(second.refundAmount()).isEqualTo(first.refundAmount());
            assertThat(second.transactionId()).isEqualTo(first.transactionId());
            assertThat(reload(ws.id()).getBalance()).isEqualTo(70L);
            LedgerAsserts.assertSingleTerminalEntry(
                    transactionRepository.findByReservationIdOrderByCreatedAtAsc(reservation.id()));
        }

        @Test
        @DisplayName("usage beyond the estimate is absorbed and flagged when there is no allowance")
        void overrunIsAbsorbed() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);

            SettlementResultDto result = billingService.settle(reservation.id(), 80);

            assertThat(result.chargedAmount()).isEqualTo(50L);
            assertThat(result.absorbedAmount()).isEqualTo(30L);
            assertThat(reload(ws.id()).getBalance()).isEqualTo(50L);

            List<CreditTransaction> entries = transactionRepository.findByReservationIdOrderByCreatedAtAsc(reservation.id());
            assertThat(entries).filteredOn(tx -> tx.getType() == CreditTransactionType.ADJUSTMENT)
                    .singleElement()
                    .satisfies(tx -> {
                        assertThat(tx.getAmount()).isZero();
                        assertThat(tx.getUnits()).isEqualTo(30L);
                        assertThat(tx.getIdempotencyKey()).isEqualTo("overrun:" + reservation.id());
                    });
            assertLedgerInvariants(ws.id());
        }

        @Test
        void unknownReservationIsNotFound() {
            UUID missing = UUID.randomUUID();

            SettlementResultDto result = billingService.settle(missing, 10);

            assertThat(result.outcome()).isEqualTo(TerminalOutcome.NOT_FOUND);
            assertThat(result.reservationId()).isEqualTo(missing);
        }

        @Test
        void negativeActualIsRejected() {
            assertThatThrownBy(() -> billingService.settle(UUID.randomUUID(), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("release")
    class Release {

        @Test
        @DisplayName("returns the full estimate to the balance")
        void restoresEstimate() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);

            ReleaseResultDto result = billingService.release(reservation.id(), "provider error");

            assertThat(result.outcome()).isEqualTo(TerminalOutcome.RELEASED);
            assertThat(result.releasedAmount()).isEqualTo(50L);
            Workspace workspace = reload(ws.id());
            assertThat(workspace.getBalance()).isEqualTo(100L);
            assertThat(workspace.getReserved()).isZero();

            CreditTransaction release = transactionRepository.findByIdempotencyKey("release:" + reservation.id()).orElseThrow();
            assertThat(release.getAmount()).isEqualTo(50L);
            assertThat(release.getSource()).isEqualTo(CreditTransactionSource.ORCHESTRATOR);
            assertThat(billingService.getReservation(reservation.id()).releaseReason()).isEqualTo("provider error");
            assertLedgerInvariants(ws.id());
        }

        @Test
        @DisplayName("a settled reservation cannot be released")
        void releaseAfterSettle() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);
            billingService.settle(reservation.id(), 50);

            ReleaseResultDto result = billingService.release(reservation.id(), null);

            assertThat(result.outcome()).isEqualTo(TerminalOutcome.ALREADY_SETTLED);
            assertThat(result.releasedAmount()).isZero();
            assertThat(reload(ws.id()).getBalance()).isEqualTo(50L);
        }

        @Test
        @DisplayName("a released reservation cannot be settled")
        void settleAfterRelease() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);
            billingService.release(reservation.id(), null);

            SettlementResultDto result = billingService.settle(reservation.id(), 20);

            assertThat(result.outcome()).isEqualTo(TerminalOutcome.ALREADY_RELEASED);
            assertThat(result.chargedAmount()).isZero();
            assertThat(reload(ws.id()).getBalance()).isEqualTo(100L);
            assertThat(transactionRepository.findByIdempotencyKey("settle:" + reservation.id())).isEmpty();
        }
    }

    @Nested
    @DisplayName("expiry sweep")
    class Expiry {

        private void expire(UUID reservationId) {
            Reservation reservation = reservationRepository.findById(reservationId).orElseThrow();
            reservation.setExpiresAt(LocalDateTime.now(clock).minusMinutes(5));
            reservationRepository.save(reservation);
        }

        @Test
        @DisplayName("releases holds past their TTL and a late settle is a no-op")
        void lateSettleAfterSweep() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);
            expire(reservation.id());

            int released = billingService.expireReservations();

            assertThat(released).isGreaterThanOrEqualTo(1);
            ReservationDto swept = billingService.getReservation(reservation.id());
            assertThat(swept.state()).isEqualTo(ReservationState.RELEASED);
            assertThat(swept.releaseReason()).isEqualTo("expired");
            assertThat(transactionRepository.findByIdempotencyKey("release:" + reservation.id()))
                    .hasValueSatisfying(tx -> assertThat(tx.getSource()).isEqualTo(CreditTransactionSource.SWEEPER));

            SettlementResultDto late = billingService.settle(reservation.id(), 30);

            assertThat(late.outcome()).isEqualTo(TerminalOutcome.ALREADY_RELEASED);
            assertThat(reload(ws.id()).getBalance()).isEqualTo(100L);
            LedgerAsserts.assertSingleTerminalEntry(
                    transactionRepository.findByReservationIdOrderByCreatedAtAsc(reservation.id()));
            assertLedgerInvariants(ws.id());
        }

        @Test
        @DisplayName("holds inside their TTL are left alone")
        void liveHoldsAreKept() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            ReservationDto reservation = fixtures.reserve(ws.id(), 50);

            billingService.expireReservations();

            assertThat(billingService.getReservation(reservation.id()).state()).isEqualTo(ReservationState.HELD);
            assertThat(reload(ws.id()).getReserved()).isEqualTo(50L);
        }
    }

    @Nested
    @DisplayName("grants and adjustments")
    class Grants {

        @Test
        @DisplayName("a purchase is applied once per idempotency key")
        void purchaseIsIdempotent() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(10);
            String key = "checkout-" + UUID.randomUUID();

            TransactionDto first = billingService.creditPurchase(ws.id(), 500, key, "cs_test_1");
            TransactionDto second = billingService.creditPurchase(ws.id(), 500, key, "cs_test_1");

            assertThat(second.id()).isEqualTo(first.id());
            assertThat(reload(ws.id()).getBalance()).isEqualTo(510L);
            assertThatThrownBy(() -> billingService.creditPurchase(ws.id(), 700, key, "cs_test_1"))
                    .isInstanceOf(IdempotencyConflictException.class);
            assertLedgerInvariants(ws.id());
        }

        @Test
        @DisplayName("a negative adjustment never takes the balance below zero")
        void negativeAdjustmentBounded() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);

            billingService.creditAdjustment(ws.id(), -30, "adj-" + UUID.randomUUID(), "goodwill reversal");

            assertThat(reload(ws.id()).getBalance()).isEqualTo(70L);
            assertThatThrownBy(() -> billingService.creditAdjustment(ws.id(), -71, "adj-" + UUID.randomUUID(), "too much"))
                    .isInstanceOf(InsufficientCreditsException.class);
            assertThat(reload(ws.id()).getBalance()).isEqualTo(70L);
            assertLedgerInvariants(ws.id());
        }

        @Test
        @DisplayName("the plan allotment is granted once per billing period")
        void allotmentOncePerPeriod() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            LocalDateTime nextStart = ws.billingPeriodEnd();
            LocalDateTime nextEnd = nextStart.plusMonths(1);

            billingService.startBillingPeriod(ws.id(), nextStart, nextEnd);
            BalanceDto balance = billingService.startBillingPeriod(ws.id(), nextStart, nextEnd);

            assertThat(balance.balance()).isEqualTo(200L);
            assertThat(balance.billingPeriodStart()).isEqualTo(nextStart);
            assertThat(ledger(ws.id())).filteredOn(tx -> tx.getType() == CreditTransactionType.ALLOTMENT).hasSize(2);
        }

        @Test
        void periodCannotMoveBackwards() {
            WorkspaceDto ws = fixtures.workspaceWithBalance(100);
            LocalDateTime earlier = ws.billingPeriodStart().minusMonths(1);

            assertThatThrownBy(() -> billingService.startBillingPeriod(ws.id(), earlier, ws.billingPeriodStart()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("conservation holds across a mixed sequence of operations")
    void conservationAcrossMixedOperations() {
        WorkspaceDto ws = fixtures.workspaceWithBalance(1000);
        ReservationDto settled = fixtures.reserve(ws.id(), 200);
        ReservationDto released = fixtures.reserve(ws.id(), 150);
        ReservationDto overrun = fixtures.reserve(ws.id(), 100);
        fixtures.reserve(ws.id(), 75);

        billingService.settle(settled.id(), 120);
        billingService.release(released.id(), "cancelled");
        billingService.settle(overrun.id(), 140);
        billingService.creditPurchase(ws.id(), 300, "purchase-" + UUID.randomUUID(), null);
        billingService.creditAdjustment(ws.id(), -25, "adj-" + UUID.randomUUID(), "correction");

        Workspace workspace = reload(ws.id());
        // 1000 + 300 - 120 - 100 - 25
        assertThat(workspace.getBalance() + workspace.getReserved()).isEqualTo(1055L);
        assertThat(workspace.getReserved()).isEqualTo(75L);
        assertLedgerInvariants(ws.id());
    }
}
