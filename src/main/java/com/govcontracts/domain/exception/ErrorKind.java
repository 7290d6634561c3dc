package com.govcontracts.domain.exception;

import java.util.Locale;

/**
 * Classification of failures surfaced to callers.
 *
 * The validation kinds map to HTTP 400 and are never retried.
 */
public enum ErrorKind {
    VALIDATION,
    INVALID_SORT_FIELD,
    INVALID_PAGE_SIZE,
    INVALID_TIME_RANGE,
    INVALID_DIMENSION,
    SEARCH,
    AGGREGATION,
    EXPORT,
    FILTER_OPTIONS,
    TASK_NOT_FOUND,
    DATASET_UNAVAILABLE;

    public boolean isValidation() {
        return this == VALIDATION
                || this == INVALID_SORT_FIELD
                || this == INVALID_PAGE_SIZE
                || this == INVALID_TIME_RANGE
                || this == INVALID_DIMENSION;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
