package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;
import lombok.Value;

import java.util.List;

@Value
public class OrNode implements FilterNode {

    List<FilterNode> children;

    /**
     * Disjunction of the given nodes. Any {@link MatchAll} child makes the
     * whole disjunction unconstrained; no children means no constraint either.
     */
    public static FilterNode of(List<FilterNode> children) {
        if (children.isEmpty() || children.stream().anyMatch(child -> child instanceof MatchAll)) {
            return MatchAll.INSTANCE;
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return new OrNode(List.copyOf(children));
    }

    @Override
    public boolean matches(ContractRecord record) {
        return children.stream().anyMatch(child -> child.matches(record));
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
