package uk.gegc.reelstudio.features.provider.domain.exception;

/**
 * Transient failure talking to the video generation provider: I/O error, timeout or a non-2xx answer.
 * Callers leave the job in its current state and try again later.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
