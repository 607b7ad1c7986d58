package uk.gegc.creditledger.features.billing.testutils;

import org.assertj.core.api.Assertions;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransaction;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;
import uk.gegc.creditledger.features.billing.domain.model.Reservation;
import uk.gegc.creditledger.features.billing.domain.model.ReservationState;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;

import java.util.List;

/**
 * Assertions for the ledger invariants that must hold after every committed operation.
 */
public final class LedgerAsserts {

    private LedgerAsserts() {
        // Utility class
    }

    /**
     * balance + reserved equals the sum of the credit-moving ledger entries
     * (grants minus charges); hold movements only shift credits between the two buckets.
     */
    public static void assertConservation(Workspace workspace, List<CreditTransaction> ledger) {
        long ledgerTotal = ledger.stream()
                .filter(tx -> !tx.getType().isHoldMovement())
                .mapToLong(CreditTransaction::getAmount)
                .sum();
        Assertions.assertThat(workspace.getBalance() + workspace.getReserved())
                .as("balance + reserved == Σ(non-hold ledger amounts) for workspace %s", workspace.getId())
                .isEqualTo(ledgerTotal);
        Assertions.assertThat(workspace.getBalance() + workspace.getReserved())
                .as("balance + reserved == granted - charged for workspace %s", workspace.getId())
                .isEqualTo(workspace.getTotalGranted() - workspace.getTotalCharged());
    }

    public static void assertNonNegative(Workspace workspace) {
        Assertions.assertThat(workspace.getBalance()).as("balance").isGreaterThanOrEqualTo(0L);
        Assertions.assertThat(workspace.getReserved()).as("reserved").isGreaterThanOrEqualTo(0L);
    }

    /**
     * reserved equals the estimates of the workspace's HELD reservations.
     */
    public static void assertReservedMatchesHolds(Workspace workspace, List<Reservation> reservations) {
        long held = reservations.stream()
                .filter(r -> r.getWorkspaceId().equals(workspace.getId()))
                .filter(r -> r.getState() == ReservationState.HELD)
                .mapToLong(Reservation::getEstimatedAmount)
                .sum();
        Assertions.assertThat(workspace.getReserved())
                .as("reserved == Σ(HELD estimates) for workspace %s", workspace.getId())
                .isEqualTo(held);
    }

    /**
     * A terminal reservation has exactly one SETTLE or RELEASE entry.
     */
    public static void assertSingleTerminalEntry(List<CreditTransaction> reservationLedger) {
        long terminal = reservationLedger.stream()
                .filter(tx -> tx.getType() == CreditTransactionType.SETTLE || tx.getType() == CreditTransactionType.RELEASE)
                .count();
        Assertions.assertThat(terminal).as("terminal entries for reservation").isEqualTo(1L);
    }
}
