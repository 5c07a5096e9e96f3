package uk.gegc.reelstudio.features.billing.domain.exception;

import lombok.Getter;

/**
 * Thrown when a reservation or direct charge asks for more than {@code balance - reserved}.
 * Nothing has been written when this is raised.
 */
@Getter
public class InsufficientTokensException extends RuntimeException {

    private final long requestedTokens;
    private final long availableTokens;
    private final long shortfall;

    public InsufficientTokensException(long requestedTokens, long availableTokens) {
        super(String.format("Insufficient tokens: %d requested, %d available", requestedTokens, availableTokens));
        this.requestedTokens = requestedTokens;
        this.availableTokens = availableTokens;
        this.shortfall = Math.max(0, requestedTokens - availableTokens);
    }
}
