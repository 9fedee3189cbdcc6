package io.refactor.flowscheduler.client;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * HTTP client for the flow runner that owns and executes flows. The scheduler treats
 * a run as opaque: any 2xx answer is a success, anything else raises.
 */
@Component
public class FlowRunnerClient {
    private final RestTemplate rest;
    private final String baseUrl;
    private final String apiKey;

    @Autowired
    public FlowRunnerClient(org.springframework.core.env.Environment env) {
        this(new RestTemplate(),
                env.getProperty("flow-runner.url", "http://localhost:7860"),
                env.getProperty("flow-runner.api-key"));
    }

    FlowRunnerClient(RestTemplate rest, String baseUrl, String apiKey) {
        this.rest = rest;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    public Optional<FlowSummary> findFlow(UUID flowId) {
        String url = baseUrl + "/api/v1/flows/" + flowId;
        try {
            ResponseEntity<FlowSummary> resp = rest.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), FlowSummary.class);
            return Optional.ofNullable(resp.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    public String runFlow(UUID flowId, UUID scheduleId) {
        String url = baseUrl + "/api/v1/run/" + flowId + "?stream=false";
        Map<String, Object> body = Map.of(
            "input_type", "chat",
            "output_type", "chat",
            "tweaks", Map.of(),
            "session_id", "schedule-" + scheduleId
        );
        HttpEntity<Map<String, Object>> req = new HttpEntity<>(body, headers());
        ResponseEntity<String> resp = rest.postForEntity(url, req, String.class);
        return resp.getBody();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(java.util.List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("x-api-key", apiKey);
        }
        return headers;
    }
}
