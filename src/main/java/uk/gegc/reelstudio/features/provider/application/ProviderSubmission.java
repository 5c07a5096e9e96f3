package uk.gegc.reelstudio.features.provider.application;

/**
 * What the provider needs to render one segment.
 */
public record ProviderSubmission(
        String model,
        String resolution,
        int durationSec,
        String prompt,
        String shotType,
        String cameraMove
) {}
