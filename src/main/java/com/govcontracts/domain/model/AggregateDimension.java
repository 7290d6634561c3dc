package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Grouping dimension for rollups.
 *
 * Each dimension knows its canonical column and the entity name of its
 * precomputed {@code agg_<entity>.parquet} partition.
 */
public enum AggregateDimension {
    BY_CONTRACTOR("by_contractor", "awardee_name", "contractor"),
    BY_ORGANIZATION("by_organization", "organization_name", "organization"),
    BY_AREA("by_area", "area_of_delivery", "area"),
    BY_CATEGORY("by_category", "business_category", "business_category");

    private final String key;
    private final String column;
    private final String entity;

    AggregateDimension(String key, String column, String entity) {
        this.key = key;
        this.column = column;
        this.entity = entity;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String column() {
        return column;
    }

    public String entity() {
        return entity;
    }

    /**
     * File-name stem used for aggregated exports, e.g. {@code contractor_export.csv}.
     */
    public String exportName() {
        return key.substring("by_".length());
    }

    @JsonCreator
    public static AggregateDimension fromKey(String value) {
        if (value == null || value.isBlank()) {
            return BY_CONTRACTOR;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AggregateDimension dimension : values()) {
            if (dimension.key.equals(normalized) || dimension.name().equalsIgnoreCase(normalized)) {
                return dimension;
            }
        }
        throw new ValidationException(ErrorKind.INVALID_DIMENSION,
                "Invalid dimension '" + value + "'. Allowed: " + Arrays.stream(values())
                        .map(AggregateDimension::key)
                        .collect(Collectors.joining(", ")));
    }
}
