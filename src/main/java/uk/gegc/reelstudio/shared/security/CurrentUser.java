package uk.gegc.reelstudio.shared.security;

import org.springframework.security.core.Authentication;
import uk.gegc.reelstudio.shared.exception.ForbiddenException;

import java.util.UUID;

public final class CurrentUser {

    private CurrentUser() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Resolves the acting user's id from the principal name set by {@link TrustedUserHeaderFilter}.
     */
    public static UUID id(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new ForbiddenException("No authenticated user");
        }
        try {
            return UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException e) {
            throw new ForbiddenException("Authenticated principal is not a user id", e);
        }
    }
}
