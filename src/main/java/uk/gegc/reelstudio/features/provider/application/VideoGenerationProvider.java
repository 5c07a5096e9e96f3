package uk.gegc.reelstudio.features.provider.application;

import uk.gegc.reelstudio.features.provider.domain.exception.ProviderException;

/**
 * External video generation provider. Calls are slow and may fail; every failure surfaces as a
 * {@link ProviderException} and must be treated as transient.
 */
public interface VideoGenerationProvider {

    /**
     * @return the provider's task id
     */
    String submit(ProviderSubmission submission) throws ProviderException;

    ProviderTaskStatus queryStatus(String model, String taskId) throws ProviderException;
}
