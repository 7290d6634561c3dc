package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Reply to a task submission. {@code status} is {@code queued}, or
 * {@code cached} when a successful result for the same request already exists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskSubmission {

    public static final String QUEUED = "queued";
    public static final String CACHED = "cached";

    @JsonProperty("task_id")
    private UUID taskId;

    @JsonProperty("cache_key")
    private String cacheKey;

    private String status;
}
