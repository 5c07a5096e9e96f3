package uk.gegc.reelstudio.shared.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Turns the user id forwarded by the upstream auth layer into the request's {@code Authentication}.
 * The header is trusted as-is; requests without a parsable id stay anonymous and are rejected downstream.
 */
@Slf4j
public class TrustedUserHeaderFilter extends OncePerRequestFilter {

    private final String headerName;

    public TrustedUserHeaderFilter(String headerName) {
        this.headerName = headerName;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull FilterChain filterChain) throws ServletException, IOException {
        String rawUserId = request.getHeader(headerName);

        if (rawUserId != null && !rawUserId.isBlank()) {
            try {
                UUID userId = UUID.fromString(rawUserId.trim());
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        userId.toString(), null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authenticated forwarded user: {}", userId);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed {} header on {} {}", headerName, request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
