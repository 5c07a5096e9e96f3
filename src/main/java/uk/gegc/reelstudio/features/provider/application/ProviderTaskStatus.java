package uk.gegc.reelstudio.features.provider.application;

import uk.gegc.reelstudio.features.provider.domain.model.ProviderTaskState;

public record ProviderTaskStatus(
        String taskId,
        ProviderTaskState state,
        String resultUrl,
        String errorMessage
) {}
