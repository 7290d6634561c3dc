package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;

/**
 * Node of a compiled filter predicate.
 *
 * A tree can be evaluated directly against a record, or walked by a
 * {@link FilterVisitor} to produce a query for the columnar engine.
 */
public interface FilterNode {

    boolean matches(ContractRecord record);

    <R> R accept(FilterVisitor<R> visitor);
}
