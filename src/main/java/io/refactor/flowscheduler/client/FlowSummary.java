package io.refactor.flowscheduler.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowSummary(
        UUID id,
        String name,
        @JsonProperty("user_id") UUID userId
) {
}
