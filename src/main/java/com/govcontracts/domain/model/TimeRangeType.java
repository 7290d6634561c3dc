package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TimeRangeType {
    @JsonProperty("yearly")
    YEARLY,
    @JsonProperty("quarterly")
    QUARTERLY,
    @JsonProperty("custom")
    CUSTOM
}
