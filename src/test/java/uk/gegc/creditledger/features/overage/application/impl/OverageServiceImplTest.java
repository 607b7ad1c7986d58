package uk.gegc.creditledger.features.overage.application.impl;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class OverageServiceImplTest {

    @Test
    void chargeIsRoundedHalfUpToCents() {
        assertThat(OverageServiceImpl.chargeFor(500, new BigDecimal("0.01"))).isEqualByComparingTo("5.00");
        assertThat(OverageServiceImpl.chargeFor(1, new BigDecimal("0.005"))).isEqualByComparingTo("0.01");
        assertThat(OverageServiceImpl.chargeFor(1, new BigDecimal("0.004"))).isEqualByComparingTo("0.00");
        assertThat(OverageServiceImpl.chargeFor(333, new BigDecimal("0.0125")).scale()).isEqualTo(2);
    }

    @Test
    void descriptionNamesUnitsAndRate() {
        assertThat(OverageServiceImpl.describe(500, new BigDecimal("0.010000")))
                .isEqualTo("Overage charges: 500 credits @ $0.01 per credit");
    }

    @Test
    void idempotencyKeyIsStablePerPeriod() {
        UUID workspaceId = UUID.fromString("6f1c1c7e-3d2a-4c55-9a4e-0d9b2f8f1a11");
        LocalDateTime start = LocalDateTime.of(2025, 1, 1, 0, 0);
        LocalDateTime end = LocalDateTime.of(2025, 2, 1, 0, 0);

        assertThat(OverageServiceImpl.idempotencyKey(workspaceId, start, end))
                .isEqualTo("overage:6f1c1c7e-3d2a-4c55-9a4e-0d9b2f8f1a11:2025-01-01T00:00:2025-02-01T00:00")
                .isEqualTo(OverageServiceImpl.idempotencyKey(workspaceId, start, end));
    }
}
