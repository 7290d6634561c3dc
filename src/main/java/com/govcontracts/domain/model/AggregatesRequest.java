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
public class AggregatesRequest extends FilterRequest {

    @Min(1)
    @Max(1000)
    @JsonProperty("topN")
    @JsonAlias({"top_n", "topn"})
    private Integer topN;

    public Integer getTopN() {
        return topN == null ? 20 : topN;
    }
}
