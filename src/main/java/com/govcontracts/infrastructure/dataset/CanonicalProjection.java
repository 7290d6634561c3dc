package com.govcontracts.infrastructure.dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Projects one fact partition onto the canonical record columns.
 *
 * Reference id, award date, contract amount and awardee name are required.
 * Other columns a file lacks come through as NULL, and {@code search_text}
 * is derived from the titles when the file has none.
 */
final class CanonicalProjection {

    private CanonicalProjection() {
    }

    static Set<String> missingCoreColumns(Set<String> columns) {
        Set<String> missing = new TreeSet<>();
        if (referenceColumn(columns) == null) {
            missing.add("contract_number|reference_id");
        }
        for (String column : List.of("award_date", "contract_amount", "awardee_name")) {
            if (!columns.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    // Column order is fixed: UNION ALL matches partitions by position.
    static String select(Partition partition) {
        Set<String> columns = partition.getColumns();
        List<String> items = new ArrayList<>();

        items.add("CAST(" + ident(referenceColumn(columns)) + " AS VARCHAR) AS reference_id");
        items.add(text(columns, "award_title"));
        items.add(text(columns, "notice_title"));
        items.add("TRY_CAST(" + ident("award_date") + " AS DATE) AS award_date");
        items.add("CAST(" + ident("awardee_name") + " AS VARCHAR) AS awardee_name");
        for (String column : List.of("organization_name", "business_category", "area_of_delivery")) {
            items.add(text(columns, column));
        }
        items.add("TRY_CAST(" + ident("contract_amount") + " AS DECIMAL(38,2)) AS contract_amount");
        items.add(text(columns, "award_status"));
        items.add(searchText(columns));
        items.add(Partition.quote(partition.getId()) + " AS partition_id");

        return "SELECT " + String.join(", ", items) + " FROM " + partition.source();
    }

    private static String referenceColumn(Set<String> columns) {
        if (columns.contains("contract_number")) {
            return "contract_number";
        }
        if (columns.contains("reference_id")) {
            return "reference_id";
        }
        return null;
    }

    private static String text(Set<String> columns, String column) {
        return columns.contains(column)
                ? "CAST(" + ident(column) + " AS VARCHAR) AS " + column
                : "CAST(NULL AS VARCHAR) AS " + column;
    }

    private static String searchText(Set<String> columns) {
        if (columns.contains("search_text")) {
            return "CAST(" + ident("search_text") + " AS VARCHAR) AS search_text";
        }
        List<String> titles = new ArrayList<>();
        for (String title : List.of("award_title", "notice_title")) {
            if (columns.contains(title)) {
                titles.add("CAST(" + ident(title) + " AS VARCHAR)");
            }
        }
        if (titles.isEmpty()) {
            return "CAST(NULL AS VARCHAR) AS search_text";
        }
        return "lower(concat_ws(' ', " + String.join(", ", titles) + ")) AS search_text";
    }

    private static String ident(String column) {
        return "\"" + column + "\"";
    }
}
