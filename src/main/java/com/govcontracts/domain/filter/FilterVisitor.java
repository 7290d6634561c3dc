package com.govcontracts.domain.filter;

public interface FilterVisitor<R> {

    R visitAnd(AndNode node);

    R visitOr(OrNode node);

    R visitSubstring(SubstringMatch node);

    R visitNumericRange(NumericRange node);

    R visitDateRange(DateRange node);

    R visitMatchAll(MatchAll node);
}
