package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured search result. Execution failures are reported through
 * {@code success=false} and {@code error}, never thrown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContractSearchResponse {

    private boolean success;
    private List<ContractRecord> data;
    private Pagination pagination;
    private String error;

    public static ContractSearchResponse failure(int page, int pageSize, String error) {
        return ContractSearchResponse.builder()
                .success(false)
                .data(List.of())
                .pagination(Pagination.empty(page, pageSize))
                .error(error)
                .build();
    }
}
