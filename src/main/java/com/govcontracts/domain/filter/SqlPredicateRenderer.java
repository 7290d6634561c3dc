package com.govcontracts.domain.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a filter tree as a DuckDB WHERE expression over the canonical columns.
 *
 * Every user-supplied value becomes a {@code ?} parameter. The only text
 * spliced into the SQL is column names taken from {@link ContractField}.
 */
public class SqlPredicateRenderer implements FilterVisitor<SqlFragment> {

    private static final SqlPredicateRenderer INSTANCE = new SqlPredicateRenderer();

    public static SqlFragment render(FilterNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public SqlFragment visitAnd(AndNode node) {
        return join(node.getChildren(), " AND ");
    }

    @Override
    public SqlFragment visitOr(OrNode node) {
        return join(node.getChildren(), " OR ");
    }

    @Override
    public SqlFragment visitSubstring(SubstringMatch node) {
        String column = node.getField().column();
        String test = "contains(lower(" + column + "), ?)";
        String sql = node.isNullSafe() ? "(" + column + " IS NOT NULL AND " + test + ")" : test;
        return new SqlFragment(sql, List.of(node.getTerm()));
    }

    @Override
    public SqlFragment visitNumericRange(NumericRange node) {
        List<String> parts = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (node.getMin() != null) {
            parts.add("CAST(contract_amount AS DOUBLE) >= ?");
            params.add(node.getMin());
        }
        if (node.getMax() != null) {
            parts.add("CAST(contract_amount AS DOUBLE) <= ?");
            params.add(node.getMax());
        }
        if (parts.isEmpty()) {
            return new SqlFragment("TRUE", List.of());
        }
        return new SqlFragment("(" + String.join(" AND ", parts) + ")", params);
    }

    @Override
    public SqlFragment visitDateRange(DateRange node) {
        return new SqlFragment("(award_date BETWEEN CAST(? AS DATE) AND CAST(? AS DATE))",
                List.of(node.getStart().toString(), node.getEnd().toString()));
    }

    @Override
    public SqlFragment visitMatchAll(MatchAll node) {
        return new SqlFragment("TRUE", List.of());
    }

    private SqlFragment join(List<FilterNode> children, String operator) {
        List<String> parts = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (FilterNode child : children) {
            SqlFragment fragment = child.accept(this);
            parts.add(fragment.getSql());
            params.addAll(fragment.getParams());
        }
        return new SqlFragment("(" + String.join(operator, parts) + ")", params);
    }
}
