package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;
import lombok.Value;

import java.util.List;

@Value
public class AndNode implements FilterNode {

    List<FilterNode> children;

    /**
     * Conjunction of the given nodes, collapsing the empty and single-child cases.
     */
    public static FilterNode of(List<FilterNode> children) {
        List<FilterNode> constraining = children.stream()
                .filter(child -> !(child instanceof MatchAll))
                .toList();
        if (constraining.isEmpty()) {
            return MatchAll.INSTANCE;
        }
        if (constraining.size() == 1) {
            return constraining.get(0);
        }
        return new AndNode(constraining);
    }

    @Override
    public boolean matches(ContractRecord record) {
        return children.stream().allMatch(child -> child.matches(record));
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
