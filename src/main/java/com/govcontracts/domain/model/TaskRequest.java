package com.govcontracts.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Background task submission: a kind plus the JSON body the matching
 * synchronous endpoint would accept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {

    @NotNull
    private TaskKind kind;

    private JsonNode params;
}
