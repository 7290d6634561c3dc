package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One group of a dimension rollup. {@code avgValue} is only filled by the
 * paginated rollup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AggregateRow {

    private String label;

    @JsonProperty("total_value")
    private Double totalValue;

    private long count;

    @JsonProperty("avg_value")
    private Double avgValue;
}
