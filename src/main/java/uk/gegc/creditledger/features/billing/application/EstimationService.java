package uk.gegc.creditledger.features.billing.application;

import uk.gegc.creditledger.features.billing.api.dto.EstimateRequest;
import uk.gegc.creditledger.features.billing.api.dto.EstimationDto;

public interface EstimationService {

    /**
     * Conservative credit estimate for a generation request.
     * Deterministic for identical input and never below 1 credit.
     *
     * @throws uk.gegc.creditledger.features.billing.domain.exception.UnknownModelException
     *         if the model is not in the pricing table or does not offer the requested capability
     */
    EstimationDto estimate(EstimateRequest request);
}
