package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a request's time filter.
 *
 * Only {@code type} is checked on input. Missing or unparseable fields make
 * the entry invalid and the compiler skips it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimeRange {

    private TimeRangeType type;
    private Integer year;
    private Integer quarter;

    @JsonProperty("startDate")
    @JsonAlias("start_date")
    private String startDate;

    @JsonProperty("endDate")
    @JsonAlias("end_date")
    private String endDate;

    public static TimeRange yearly(int year) {
        return TimeRange.builder().type(TimeRangeType.YEARLY).year(year).build();
    }

    public static TimeRange quarterly(int year, int quarter) {
        return TimeRange.builder().type(TimeRangeType.QUARTERLY).year(year).quarter(quarter).build();
    }

    public static TimeRange custom(String startDate, String endDate) {
        return TimeRange.builder().type(TimeRangeType.CUSTOM).startDate(startDate).endDate(endDate).build();
    }
}
