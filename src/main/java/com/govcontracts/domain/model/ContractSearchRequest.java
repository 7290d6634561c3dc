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
 * Search request: filter plus page window and sort.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ContractSearchRequest extends FilterRequest {

    @Min(1)
    private Integer page;

    @Min(1)
    @Max(1000)
    @JsonProperty("page_size")
    @JsonAlias("pageSize")
    private Integer pageSize;

    @JsonProperty("sortBy")
    @JsonAlias({"sort_by", "sortField", "sort_field"})
    private String sortBy;

    @JsonProperty("sortDirection")
    @JsonAlias({"sort_direction", "sortDir", "sort_dir"})
    private String sortDirection;

    public Integer getPage() {
        return page == null ? 1 : page;
    }

    public Integer getPageSize() {
        return pageSize == null ? 20 : pageSize;
    }

    public String getSortBy() {
        return sortBy == null || sortBy.isBlank() ? "award_date" : sortBy;
    }
}
