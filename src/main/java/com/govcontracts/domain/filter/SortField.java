package com.govcontracts.domain.filter;

import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.exception.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Allow-list of record sort fields.
 *
 * Only these columns ever reach an ORDER BY clause; anything else is rejected
 * before a query is built. Numeric fields are ordered as DOUBLE so amounts
 * never compare as text.
 */
public enum SortField {
    AWARD_DATE("award_date", false, List.of("award_date")),
    CONTRACT_AMOUNT("contract_amount", true,
            List.of("contract_amount", "contract_value", "award_amount", "total_contract_amount")),
    REFERENCE_ID("reference_id", false, List.of("reference_id", "contract_no")),
    // the dataset has no creation timestamp
    CREATED_AT("award_date", false, List.of("created_at")),
    ORGANIZATION_NAME("organization_name", false, List.of("organization_name")),
    AWARDEE_NAME("awardee_name", false, List.of("awardee_name")),
    BUSINESS_CATEGORY("business_category", false, List.of("business_category")),
    AREA_OF_DELIVERY("area_of_delivery", false, List.of("area_of_delivery")),
    AWARD_STATUS("award_status", false, List.of("award_status")),
    AWARD_TITLE("award_title", false, List.of("award_title")),
    NOTICE_TITLE("notice_title", false, List.of("notice_title"));

    private final String column;
    private final boolean numeric;
    private final List<String> names;

    SortField(String column, boolean numeric, List<String> names) {
        this.column = column;
        this.numeric = numeric;
        this.names = names;
    }

    public String column() {
        return column;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public static SortField resolve(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SortField field : values()) {
                if (field.names.contains(normalized)) {
                    return field;
                }
            }
        }
        throw new ValidationException(ErrorKind.INVALID_SORT_FIELD,
                "Invalid sort field '" + value + "'. Allowed: " + allowedNames());
    }

    public static String allowedNames() {
        return Arrays.stream(values())
                .flatMap(field -> field.names.stream())
                .collect(Collectors.joining(", "));
    }
}
