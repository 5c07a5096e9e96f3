package uk.gegc.reelstudio.features.provider.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import uk.gegc.reelstudio.features.provider.application.ProviderSubmission;
import uk.gegc.reelstudio.features.provider.application.ProviderTaskStatus;
import uk.gegc.reelstudio.features.provider.application.VideoGenerationProvider;
import uk.gegc.reelstudio.features.provider.domain.exception.ProviderException;
import uk.gegc.reelstudio.features.provider.domain.model.ProviderTaskState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content-generation task API over JSON: {@code POST /contents/generations/tasks} to submit,
 * {@code GET /contents/generations/tasks/{id}} to poll.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpVideoGenerationProvider implements VideoGenerationProvider {

    private static final String TASKS_PATH = "/contents/generations/tasks";

    private final RestTemplate providerRestTemplate;
    private final ProviderProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Override
    public String submit(ProviderSubmission submission) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.resolveModelId(submission.model()));
        body.put("content", List.of(Map.of("type", "text", "text", buildPromptText(submission))));
        body.put("resolution", submission.resolution());
        body.put("ratio", properties.getDefaultRatio());
        body.put("duration", submission.durationSec());
        body.put("seed", -1);
        body.put("watermark", false);

        log.info("Submitting generation task: model={}, resolution={}, duration={}s",
                submission.model(), submission.resolution(), submission.durationSec());

        JsonNode root = call("submit", HttpMethod.POST, properties.getBaseUrl() + TASKS_PATH, body);
        String taskId = root.path("id").asText(null);
        if (!StringUtils.hasText(taskId)) {
            throw new ProviderException("Provider accepted the submission but returned no task id");
        }
        return taskId;
    }

    @Override
    public ProviderTaskStatus queryStatus(String model, String taskId) {
        JsonNode root = call("query", HttpMethod.GET, properties.getBaseUrl() + TASKS_PATH + "/" + taskId, null);

        String rawStatus = root.path("status").asText(null);
        ProviderTaskState state = ProviderTaskState.fromProviderStatus(rawStatus);
        log.debug("Task {} ({}) reported status {} -> {}", taskId, model, rawStatus, state);

        return switch (state) {
            case SUCCEEDED -> new ProviderTaskStatus(taskId, state, extractVideoUrl(root), null);
            case FAILED -> {
                String message = root.path("error").path("message").asText(null);
                yield new ProviderTaskStatus(taskId, state, null,
                        StringUtils.hasText(message) ? message : "Task " + rawStatus);
            }
            default -> new ProviderTaskStatus(taskId, state, null, null);
        };
    }

    private JsonNode call(String operation, HttpMethod method, String url, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StringUtils.hasText(properties.getApiKey())) {
            headers.setBearerAuth(properties.getApiKey());
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            String requestJson = body != null ? objectMapper.writeValueAsString(body) : null;
            ResponseEntity<String> response = providerRestTemplate.exchange(
                    url, method, new HttpEntity<>(requestJson, headers), String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ProviderException("Provider " + operation + " returned " + response.getStatusCode());
            }
            JsonNode root = objectMapper.readTree(response.getBody());
            outcome = "success";
            return root;
        } catch (RestClientException e) {
            log.warn("Provider {} call failed: {}", operation, e.getMessage());
            throw new ProviderException("Provider " + operation + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            log.warn("Provider {} returned unreadable JSON: {}", operation, e.getOriginalMessage());
            throw new ProviderException("Provider " + operation + " returned an unreadable response", e);
        } finally {
            sample.stop(Timer.builder("provider.requests")
                    .description("Latency of video generation provider calls")
                    .tag("operation", operation)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private String extractVideoUrl(JsonNode root) {
        JsonNode content = root.path("content");
        if (content.isArray()) {
            for (JsonNode item : content) {
                if ("video_url".equals(item.path("type").asText())) {
                    String url = item.path("video_url").path("url").asText(null);
                    if (StringUtils.hasText(url)) {
                        return url;
                    }
                }
            }
        } else if (content.isObject()) {
            return content.path("video_url").asText(null);
        }
        return null;
    }

    private String buildPromptText(ProviderSubmission submission) {
        StringBuilder text = new StringBuilder(submission.prompt());
        if (StringUtils.hasText(submission.shotType())) {
            text.append(" [shot: ").append(submission.shotType()).append(']');
        }
        if (StringUtils.hasText(submission.cameraMove())) {
            text.append(" [camera: ").append(submission.cameraMove()).append(']');
        }
        return text.toString();
    }
}
