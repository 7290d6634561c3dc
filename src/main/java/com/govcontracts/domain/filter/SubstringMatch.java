package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;
import lombok.Value;

import java.util.Locale;

/**
 * Case-insensitive substring test on one text column. The term is stored
 * lower-cased. A NULL column value never matches; {@code nullSafe} makes
 * the rendered query test for NULL explicitly.
 */
@Value
public class SubstringMatch implements FilterNode {

    ContractField field;
    String term;
    boolean nullSafe;

    public static SubstringMatch of(ContractField field, String term, boolean nullSafe) {
        return new SubstringMatch(field, term.toLowerCase(Locale.ROOT), nullSafe);
    }

    @Override
    public boolean matches(ContractRecord record) {
        String value = field.valueOf(record);
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitSubstring(this);
    }
}
