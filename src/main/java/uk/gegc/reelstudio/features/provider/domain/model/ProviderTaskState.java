package uk.gegc.reelstudio.features.provider.domain.model;

import java.util.Locale;

/**
 * Provider-side task state, normalised from the provider's status strings.
 */
public enum ProviderTaskState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    /**
     * Unknown strings count as still running, so the task stays pollable.
     */
    public static ProviderTaskState fromProviderStatus(String status) {
        if (status == null) {
            return QUEUED;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "queued", "pending", "submitted" -> QUEUED;
            case "succeeded", "success", "done" -> SUCCEEDED;
            case "failed", "cancelled", "canceled", "expired" -> FAILED;
            default -> RUNNING;
        };
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
