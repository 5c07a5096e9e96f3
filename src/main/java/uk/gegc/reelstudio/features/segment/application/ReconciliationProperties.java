package uk.gegc.reelstudio.features.segment.application;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "reelstudio.reconciliation")
@Validated
@Data
public class ReconciliationProperties {

    /**
     * Whether the background sweeper polls the provider. Request-driven reconciliation always runs.
     */
    private boolean enabled = true;

    @Positive
    private long sweepIntervalMs = 30_000L;

    /**
     * Segments polled per sweep, least recently updated first.
     */
    @Positive
    private int batchSize = 100;
}
