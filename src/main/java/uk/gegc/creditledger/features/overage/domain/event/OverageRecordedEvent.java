package uk.gegc.creditledger.features.overage.domain.event;

import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Published when a period's overage is recorded for the first time. Listeners run after commit.
 */
public class OverageRecordedEvent extends ApplicationEvent {

    private final UUID workspaceId;
    private final String workspaceName;
    private final String ownerEmail;
    private final long usage;
    private final long creditLimit;
    private final BigDecimal charge;
    private final String currency;

    public OverageRecordedEvent(Object source, UUID workspaceId, String workspaceName, String ownerEmail,
                                long usage, long creditLimit, BigDecimal charge, String currency) {
        super(source);
        this.workspaceId = workspaceId;
        this.workspaceName = workspaceName;
        this.ownerEmail = ownerEmail;
        this.usage = usage;
        this.creditLimit = creditLimit;
        this.charge = charge;
        this.currency = currency;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public String getWorkspaceName() {
        return workspaceName;
    }

    public String getOwnerEmail() {
        return ownerEmail;
    }

    public long getUsage() {
        return usage;
    }

    public long getCreditLimit() {
        return creditLimit;
    }

    public BigDecimal getCharge() {
        return charge;
    }

    public String getCurrency() {
        return currency;
    }
}
