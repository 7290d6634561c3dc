package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Task state change pushed to subscribers of {@code tasks:<id>} and {@code tasks:all}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskEvent {

    @JsonProperty("task_id")
    private UUID taskId;

    private TaskState state;

    private String status;

    private int progress;

    private JsonNode result;

    private String error;
}
