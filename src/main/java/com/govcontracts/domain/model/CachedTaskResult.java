package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Terminal outcome of a task as stored under its cache key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CachedTaskResult {

    public static final String NOT_READY = "not_ready";
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private String status;
    private JsonNode data;
    private String error;

    public static CachedTaskResult notReady() {
        return CachedTaskResult.builder().status(NOT_READY).build();
    }

    public static CachedTaskResult success(JsonNode data) {
        return CachedTaskResult.builder().status(SUCCESS).data(data).build();
    }

    public static CachedTaskResult error(String error) {
        return CachedTaskResult.builder().status(ERROR).error(error).build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
