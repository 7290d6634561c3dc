package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskView {

    @JsonProperty("task_id")
    private UUID taskId;

    private TaskKind kind;

    private TaskState state;

    private int progress;

    private String status;

    @JsonProperty("cache_key")
    private String cacheKey;

    private JsonNode result;

    private String error;

    @JsonProperty("retry_count")
    private int retryCount;

    @JsonProperty("max_retries")
    private int maxRetries;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;
}
