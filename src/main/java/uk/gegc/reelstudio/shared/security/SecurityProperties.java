package uk.gegc.reelstudio.shared.security;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the trusted principal header forwarded by the upstream auth layer.
 */
@Configuration
@ConfigurationProperties(prefix = "reelstudio.security")
@Validated
@Data
public class SecurityProperties {

    /**
     * Header carrying the already-authenticated user id (a UUID).
     */
    @NotBlank
    private String userHeader = "X-User-Id";
}
