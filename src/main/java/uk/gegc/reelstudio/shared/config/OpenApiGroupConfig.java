package uk.gegc.reelstudio.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature area.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi tokensGroup() {
        return GroupedOpenApi.builder()
                .group("tokens")
                .displayName("Token Balance & Ledger")
                .pathsToMatch("/api/v1/tokens/**")
                .build();
    }

    @Bean
    public GroupedOpenApi segmentsGroup() {
        return GroupedOpenApi.builder()
                .group("segments")
                .displayName("Video Segments")
                .pathsToMatch("/api/v1/works/**", "/api/v1/segments/**")
                .build();
    }
}
