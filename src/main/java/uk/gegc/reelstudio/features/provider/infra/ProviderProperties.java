package uk.gegc.reelstudio.features.provider.infra;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "reelstudio.provider")
@Validated
@Data
public class ProviderProperties {

    @NotBlank
    private String baseUrl;

    private String apiKey;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * Upper bound on one provider call; a timed-out status query leaves the segment untouched.
     */
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);

    @NotBlank
    private String defaultRatio = "16:9";

    /**
     * Our model key to the provider's model id. Unmapped models are sent as-is.
     */
    private Map<String, String> modelIds = new LinkedHashMap<>();

    public String resolveModelId(String model) {
        return modelIds.getOrDefault(model, model);
    }
}
