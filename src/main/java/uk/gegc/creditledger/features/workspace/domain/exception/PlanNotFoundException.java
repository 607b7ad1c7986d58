package uk.gegc.creditledger.features.workspace.domain.exception;

import uk.gegc.creditledger.shared.exception.ResourceNotFoundException;

public class PlanNotFoundException extends ResourceNotFoundException {
    public PlanNotFoundException(String code) {
        super("Plan " + code + " not found");
    }
}
