package com.govcontracts.domain.filter;

import java.util.Locale;
import java.util.Optional;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Case-insensitive parse; empty for blank or unknown input.
     */
    public static Optional<SortDirection> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "asc", "ascending" -> Optional.of(ASC);
            case "desc", "descending" -> Optional.of(DESC);
            default -> Optional.empty();
        };
    }

    public String sql() {
        return name();
    }
}
