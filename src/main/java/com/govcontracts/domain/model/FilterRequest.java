package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-dimension filter shared by search, aggregate, distribution and export requests.
 *
 * Each dimension is a list of chips: chips are ORed, a chip may AND several
 * terms with {@code &&}, and dimensions are ANDed together. An empty list
 * imposes no constraint.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class FilterRequest {

    private List<String> contractors;
    private List<String> areas;
    private List<String> organizations;

    @JsonProperty("business_categories")
    @JsonAlias("businessCategories")
    private List<String> businessCategories;

    private List<String> keywords;

    @Valid
    @JsonProperty("time_ranges")
    @JsonAlias("timeRanges")
    private List<TimeRange> timeRanges;

    @JsonProperty("value_range")
    @JsonAlias("valueRange")
    private ValueRange valueRange;

    @JsonProperty("include_supplementary")
    @JsonAlias({"include_flood_control", "includeSupplementary"})
    private boolean includeSupplementary;

    public List<String> getContractors() {
        return orEmpty(contractors);
    }

    public List<String> getAreas() {
        return orEmpty(areas);
    }

    public List<String> getOrganizations() {
        return orEmpty(organizations);
    }

    public List<String> getBusinessCategories() {
        return orEmpty(businessCategories);
    }

    public List<String> getKeywords() {
        return orEmpty(keywords);
    }

    public List<TimeRange> getTimeRanges() {
        return orEmpty(timeRanges);
    }

    /**
     * Copy of the filter part only, used when a derived request (export, estimate)
     * must be keyed or executed without its paging fields.
     */
    @JsonIgnore
    public FilterRequest toFilter() {
        return new FilterRequest(
                new ArrayList<>(getContractors()),
                new ArrayList<>(getAreas()),
                new ArrayList<>(getOrganizations()),
                new ArrayList<>(getBusinessCategories()),
                new ArrayList<>(getKeywords()),
                new ArrayList<>(getTimeRanges()),
                valueRange,
                includeSupplementary);
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
