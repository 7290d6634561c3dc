package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Distinct non-null values per filter dimension, for dropdowns and autocomplete.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterOptions {

    private List<String> contractors;
    private List<String> areas;
    private List<String> organizations;

    @JsonProperty("business_categories")
    private List<String> businessCategories;

    private List<Integer> years;

    public static FilterOptions empty() {
        return new FilterOptions(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
