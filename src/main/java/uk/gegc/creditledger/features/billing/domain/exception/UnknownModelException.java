package uk.gegc.creditledger.features.billing.domain.exception;

public class UnknownModelException extends RuntimeException {

    private final String model;

    public UnknownModelException(String model, String message) {
        super(message);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
