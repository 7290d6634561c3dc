package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaginatedAggregatesResponse {

    private boolean success;
    private AggregateDimension dimension;
    private List<AggregateRow> data;
    private Pagination pagination;

    // "scan" or "precomputed"
    private String source;

    private String error;

    public static PaginatedAggregatesResponse failure(AggregateDimension dimension, int page, int pageSize, String error) {
        return PaginatedAggregatesResponse.builder()
                .success(false)
                .dimension(dimension)
                .data(List.of())
                .pagination(Pagination.empty(page, pageSize))
                .error(error)
                .build();
    }
}
