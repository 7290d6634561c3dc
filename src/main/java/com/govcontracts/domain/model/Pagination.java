package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pagination {

    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("total_pages")
    private long totalPages;

    @JsonProperty("has_next")
    private boolean hasNext;

    @JsonProperty("has_previous")
    private boolean hasPrevious;

    public static Pagination of(int page, int pageSize, long totalCount) {
        long totalPages = totalCount == 0 ? 0 : (totalCount + pageSize - 1) / pageSize;
        return Pagination.builder()
                .page(page)
                .pageSize(pageSize)
                .totalCount(totalCount)
                .totalPages(totalPages)
                .hasNext(page < totalPages)
                .hasPrevious(page > 1)
                .build();
    }

    public static Pagination empty(int page, int pageSize) {
        return of(page, pageSize, 0);
    }
}
