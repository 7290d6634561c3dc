package com.govcontracts.domain.filter;

import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Allow-list of sort keys for grouped rows.
 */
public enum AggregateSortField {
    TOTAL_VALUE("total_value"),
    COUNT("count"),
    AVG_VALUE("avg_value"),
    LABEL("label");

    private final String column;

    AggregateSortField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static AggregateSortField resolve(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AggregateSortField field : values()) {
                if (field.column.equals(normalized)) {
                    return field;
                }
            }
        }
        throw new ValidationException(ErrorKind.INVALID_SORT_FIELD,
                "Invalid sort field '" + value + "'. Allowed: " + Arrays.stream(values())
                        .map(AggregateSortField::column)
                        .collect(Collectors.joining(", ")));
    }

    /**
     * ORDER BY body for grouped rows under {@code alias} (empty for none),
     * with label as the tie-breaker.
     */
    public String orderBy(SortDirection direction, String alias) {
        String prefix = alias == null || alias.isEmpty() ? "" : alias + ".";
        if (this == LABEL) {
            return prefix + "label " + direction.sql() + " NULLS LAST";
        }
        return prefix + column + " " + direction.sql() + " NULLS LAST, " + prefix + "label ASC";
    }
}
