package com.govcontracts.infrastructure.dataset;

import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

/**
 * One Parquet file known to the catalog, with the columns it was probed to carry.
 */
@Value
public class Partition {

    String id;
    Path path;
    PartitionRole role;
    boolean includedByDefault;
    Instant lastModified;
    Set<String> columns;

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * {@code read_parquet('...')} table function for this file. The path
     * comes from the catalog's own directory listing, never from a request.
     */
    public String source() {
        return readParquet(path);
    }

    static String readParquet(Path path) {
        return "read_parquet(" + quote(path.toAbsolutePath().toString()) + ")";
    }

    static String quote(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }
}
