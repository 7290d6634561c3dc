package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Monthly bucket keyed {@code yyyy-MM}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyTotal {

    private String month;

    @JsonProperty("total_value")
    private Double totalValue;

    private long count;
}
