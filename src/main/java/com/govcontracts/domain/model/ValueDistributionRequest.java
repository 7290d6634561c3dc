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

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ValueDistributionRequest extends FilterRequest {

    public static final int DEFAULT_BINS = 1000;
    public static final int MAX_BINS = 10_000;

    @Min(1)
    @Max(MAX_BINS)
    @JsonProperty("num_bins")
    @JsonAlias("numBins")
    private Integer numBins;

    public Integer getNumBins() {
        return numBins == null ? DEFAULT_BINS : numBins;
    }
}
