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
public class HistogramBin {

    @JsonProperty("bin_number")
    private int binNumber;

    @JsonProperty("bin_start")
    private double binStart;

    @JsonProperty("bin_end")
    private double binEnd;

    private long count;

    @JsonProperty("total_value")
    private double totalValue;

    @JsonProperty("avg_value")
    private double avgValue;
}
