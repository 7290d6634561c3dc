package com.govcontracts.domain.filter;

import lombok.Value;

/**
 * Validated record ordering. {@code directionDefaulted} records that the
 * caller's direction was missing or unknown and DESC was used instead.
 */
@Value
public class SortSpec {

    SortField field;
    SortDirection direction;
    boolean directionDefaulted;

    public static SortSpec of(SortField field, SortDirection direction) {
        return new SortSpec(field, direction, false);
    }

    /**
     * ORDER BY body for rows exposed under {@code alias} (empty for none).
     * Ties fall back to the reference id so paging is repeatable.
     */
    public String orderBy(String alias) {
        String prefix = alias == null || alias.isEmpty() ? "" : alias + ".";
        String key = field.isNumeric()
                ? "CAST(" + prefix + field.column() + " AS DOUBLE)"
                : prefix + field.column();
        String clause = key + " " + direction.sql() + " NULLS LAST";
        if (field != SortField.REFERENCE_ID) {
            clause += ", " + prefix + "reference_id ASC NULLS LAST";
        }
        return clause;
    }
}
