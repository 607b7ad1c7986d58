package uk.gegc.creditledger.features.billing.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published inside the settling transaction once a reservation has been charged.
 */
public class CreditsSettledEvent extends ApplicationEvent {

    private final UUID workspaceId;
    private final UUID reservationId;
    private final LocalDateTime periodStart;
    private final ServiceType serviceType;
    private final String model;
    private final String provider;
    private final long chargedAmount;
    private final long actualAmount;
    private final long absorbedAmount;

    public CreditsSettledEvent(Object source, UUID workspaceId, UUID reservationId, LocalDateTime periodStart,
                               ServiceType serviceType, String model, String provider,
                               long chargedAmount, long actualAmount, long absorbedAmount) {
        super(source);
        this.workspaceId = workspaceId;
        this.reservationId = reservationId;
        this.periodStart = periodStart;
        this.serviceType = serviceType;
        this.model = model;
        this.provider = provider;
        this.chargedAmount = chargedAmount;
        this.actualAmount = actualAmount;
        this.absorbedAmount = absorbedAmount;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public UUID getReservationId() {
        return reservationId;
    }

    public LocalDateTime getPeriodStart() {
        return periodStart;
    }

    public ServiceType getServiceType() {
        return serviceType;
    }

    public String getModel() {
        return model;
    }

    public String getProvider() {
        return provider;
    }

    public long getChargedAmount() {
        return chargedAmount;
    }

    public long getActualAmount() {
        return actualAmount;
    }

    public long getAbsorbedAmount() {
        return absorbedAmount;
    }
}
