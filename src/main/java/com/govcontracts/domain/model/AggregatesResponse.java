package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Multi-view aggregate result computed from one filtered scan.
 *
 * A view that failed is present but empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AggregatesResponse {

    private boolean success;

    private AggregateSummary summary;

    @JsonProperty("by_year")
    private List<YearlyTotal> byYear;

    @JsonProperty("by_month")
    private List<MonthlyTotal> byMonth;

    @JsonProperty("by_contractor")
    private List<AggregateRow> byContractor;

    @JsonProperty("by_organization")
    private List<AggregateRow> byOrganization;

    @JsonProperty("by_area")
    private List<AggregateRow> byArea;

    @JsonProperty("by_category")
    private List<AggregateRow> byCategory;

    private String error;

    public static AggregatesResponse empty() {
        return emptyViews(true, null);
    }

    public static AggregatesResponse failure(String error) {
        return emptyViews(false, error);
    }

    private static AggregatesResponse emptyViews(boolean success, String error) {
        return AggregatesResponse.builder()
                .success(success)
                .summary(AggregateSummary.empty())
                .byYear(List.of())
                .byMonth(List.of())
                .byContractor(List.of())
                .byOrganization(List.of())
                .byArea(List.of())
                .byCategory(List.of())
                .error(error)
                .build();
    }
}
