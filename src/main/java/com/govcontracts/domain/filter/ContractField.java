package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;

import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Text columns of the canonical schema that substring filters can target.
 */
public enum ContractField {
    AWARDEE_NAME("awardee_name", ContractRecord::getAwardeeName),
    AREA_OF_DELIVERY("area_of_delivery", ContractRecord::getAreaOfDelivery),
    ORGANIZATION_NAME("organization_name", ContractRecord::getOrganizationName),
    BUSINESS_CATEGORY("business_category", ContractRecord::getBusinessCategory),
    SEARCH_TEXT("search_text", ContractField::searchTextOf);

    private final String column;
    private final Function<ContractRecord, String> accessor;

    ContractField(String column, Function<ContractRecord, String> accessor) {
        this.column = column;
        this.accessor = accessor;
    }

    public String column() {
        return column;
    }

    public String valueOf(ContractRecord record) {
        return accessor.apply(record);
    }

    // Mirrors the catalog's derivation for partitions that lack search_text.
    private static String searchTextOf(ContractRecord record) {
        if (record.getSearchText() != null) {
            return record.getSearchText();
        }
        String joined = Stream.of(record.getAwardTitle(), record.getNoticeTitle())
                .filter(value -> value != null)
                .collect(Collectors.joining(" "));
        return joined.toLowerCase(Locale.ROOT);
    }
}
