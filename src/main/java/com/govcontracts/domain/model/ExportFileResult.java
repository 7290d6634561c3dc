package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a background CSV export: where the file was written and how many rows it holds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportFileResult {

    @JsonProperty("file_name")
    private String fileName;

    private String path;

    @JsonProperty("rows_written")
    private long rowsWritten;
}
