package uk.gegc.reelstudio.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.reelstudio.features.billing.api.dto.EstimationDto;
import uk.gegc.reelstudio.features.billing.application.BillingProperties;
import uk.gegc.reelstudio.features.billing.application.EstimationService;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class EstimationServiceImpl implements EstimationService {

    private final BillingProperties billingProperties;

    @Override
    public long estimateCost(String model, String resolution, int durationSec) {
        int price = pricePerSecond(model, resolution);
        if (durationSec <= 0) {
            throw new IllegalArgumentException("Duration must be positive, got " + durationSec);
        }
        long cents = (long) price * durationSec * billingProperties.getMarkup();
        // Round up to whole tokens
        return (cents + 99) / 100;
    }

    @Override
    public EstimationDto estimate(String model, String resolution, int durationSec) {
        long tokens = estimateCost(model, resolution, durationSec);
        log.debug("Estimated {} tokens for {} {} {}s", tokens, model, resolution, durationSec);
        return new EstimationDto(
                model,
                resolution,
                durationSec,
                pricePerSecond(model, resolution),
                billingProperties.getMarkup(),
                tokens,
                EstimationDto.createHumanizedEstimate(tokens, durationSec, resolution)
        );
    }

    private int pricePerSecond(String model, String resolution) {
        Map<String, Integer> byResolution = billingProperties.getPricing().get(model);
        if (byResolution == null) {
            throw new IllegalArgumentException("Unknown model: " + model);
        }
        Integer price = byResolution.get(resolution);
        if (price == null) {
            throw new IllegalArgumentException("Model " + model + " does not support resolution " + resolution);
        }
        return price;
    }
}
