package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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
public class ValueDistributionResponse {

    private boolean success;

    @JsonProperty("min_value")
    private double minValue;

    @JsonProperty("max_value")
    private double maxValue;

    @JsonProperty("bin_width")
    private double binWidth;

    @JsonProperty("num_bins")
    private int numBins;

    @JsonProperty("total_contracts")
    private long totalContracts;

    private List<HistogramBin> bins;

    private String error;

    public static ValueDistributionResponse empty(int numBins) {
        return ValueDistributionResponse.builder()
                .success(true)
                .numBins(numBins)
                .bins(List.of())
                .build();
    }

    public static ValueDistributionResponse failure(int numBins, String error) {
        return ValueDistributionResponse.builder()
                .success(false)
                .numBins(numBins)
                .bins(List.of())
                .error(error)
                .build();
    }
}
