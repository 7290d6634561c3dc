package com.govcontracts.infrastructure.dataset;

public enum PartitionRole {
    PRIMARY,
    SUPPLEMENTARY,
    PRECOMPUTED_AGGREGATE
}
