package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Single-dimension rollup request with its own sort and page window.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PaginatedAggregatesRequest extends FilterRequest {

    private AggregateDimension dimension;

    @Min(1)
    private Integer page;

    @Min(1)
    @Max(1000)
    @JsonProperty("page_size")
    @JsonAlias("pageSize")
    private Integer pageSize;

    @JsonProperty("sort_by")
    @JsonAlias({"sortBy", "sortField"})
    private String sortBy;

    @JsonProperty("sort_direction")
    @JsonAlias({"sortDirection", "sortDir"})
    private String sortDirection;

    public AggregateDimension getDimension() {
        return dimension == null ? AggregateDimension.BY_CONTRACTOR : dimension;
    }

    public Integer getPage() {
        return page == null ? 1 : page;
    }

    public Integer getPageSize() {
        return pageSize == null ? 20 : pageSize;
    }

    public String getSortBy() {
        return sortBy == null || sortBy.isBlank() ? "total_value" : sortBy;
    }
}
