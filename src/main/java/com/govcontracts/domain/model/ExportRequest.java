package com.govcontracts.domain.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Export request. No paging or sort fields apply; {@code dimension} is used
 * only by the aggregated export.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ExportRequest extends FilterRequest {

    private AggregateDimension dimension;

    private boolean bom;

    public AggregateDimension getDimension() {
        return dimension == null ? AggregateDimension.BY_CONTRACTOR : dimension;
    }
}
