package uk.gegc.creditledger.features.billing.domain.exception;

import uk.gegc.creditledger.shared.exception.ResourceNotFoundException;

import java.util.UUID;

public class ReservationNotFoundException extends ResourceNotFoundException {
    public ReservationNotFoundException(UUID reservationId) {
        super("Reservation " + reservationId + " not found");
    }
}
