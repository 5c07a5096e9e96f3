package uk.gegc.reelstudio.features.billing.application;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token pricing. One token is one cent; provider prices are cents per generated second.
 */
@Configuration
@ConfigurationProperties(prefix = "reelstudio.billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Multiplier applied to the provider's price.
     */
    @Positive
    private int markup = 2;

    /**
     * Provider price in cents per second, keyed by model then resolution
     * (e.g. {@code reelstudio.billing.pricing.[seedance_2_0].1080p=80}).
     */
    @NotEmpty
    private Map<String, Map<String, Integer>> pricing = new LinkedHashMap<>();
}
