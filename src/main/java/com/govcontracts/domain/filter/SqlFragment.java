package com.govcontracts.domain.filter;

import lombok.Value;

import java.util.List;

/**
 * SQL boolean expression plus its positional bind values, in order.
 */
@Value
public class SqlFragment {

    String sql;
    List<Object> params;

    public Object[] paramArray() {
        return params.toArray();
    }
}
