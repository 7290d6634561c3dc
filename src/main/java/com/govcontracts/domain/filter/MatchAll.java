package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;

public final class MatchAll implements FilterNode {

    public static final MatchAll INSTANCE = new MatchAll();

    private MatchAll() {
    }

    @Override
    public boolean matches(ContractRecord record) {
        return true;
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitMatchAll(this);
    }

    @Override
    public String toString() {
        return "MatchAll";
    }
}
