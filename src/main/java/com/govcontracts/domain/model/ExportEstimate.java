package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportEstimate {

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("estimated_csv_bytes")
    private long estimatedCsvBytes;

    @JsonProperty("avg_row_bytes")
    private double avgRowBytes;

    // true when the row size was measured from a sample rather than assumed
    private boolean sampled;
}
