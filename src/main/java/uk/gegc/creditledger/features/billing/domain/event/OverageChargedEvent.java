package uk.gegc.creditledger.features.billing.domain.event;

import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published inside the transaction that writes a period's OVERAGE_CHARGE entry.
 */
public class OverageChargedEvent extends ApplicationEvent {

    private final UUID workspaceId;
    private final LocalDateTime periodStart;
    private final long overageUnits;

    public OverageChargedEvent(Object source, UUID workspaceId, LocalDateTime periodStart, long overageUnits) {
        super(source);
        this.workspaceId = workspaceId;
        this.periodStart = periodStart;
        this.overageUnits = overageUnits;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public LocalDateTime getPeriodStart() {
        return periodStart;
    }

    public long getOverageUnits() {
        return overageUnits;
    }
}
