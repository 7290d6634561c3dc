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
public class AggregateSummary {

    private long count;

    @JsonProperty("total_value")
    private double totalValue;

    @JsonProperty("avg_value")
    private double avgValue;

    public static AggregateSummary empty() {
        return new AggregateSummary(0, 0.0, 0.0);
    }
}
