package uk.gegc.reelstudio.features.billing.application;

import uk.gegc.reelstudio.features.billing.api.dto.EstimationDto;

public interface EstimationService {

    /**
     * Tokens charged for a segment: {@code ceil(pricePerSecondCents * durationSec * markup / 100)}.
     *
     * @throws IllegalArgumentException for an unpriced model/resolution pair or a non-positive duration
     */
    long estimateCost(String model, String resolution, int durationSec);

    EstimationDto estimate(String model, String resolution, int durationSec);
}
