package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"label", "total_value", "count", "avg_value"})
public class AggregateCsvRow {

    private String label;

    @JsonProperty("total_value")
    private Double totalValue;

    private long count;

    @JsonProperty("avg_value")
    private Double avgValue;

    public static AggregateCsvRow from(AggregateRow row) {
        return new AggregateCsvRow(row.getLabel(), row.getTotalValue(), row.getCount(), row.getAvgValue());
    }
}
