package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;
import lombok.Value;

/**
 * Inclusive bounds on the contract amount. Either bound may be absent.
 */
@Value
public class NumericRange implements FilterNode {

    Double min;
    Double max;

    @Override
    public boolean matches(ContractRecord record) {
        if (record.getContractAmount() == null) {
            return false;
        }
        double amount = record.getContractAmount().doubleValue();
        return (min == null || amount >= min) && (max == null || amount <= max);
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitNumericRange(this);
    }
}
