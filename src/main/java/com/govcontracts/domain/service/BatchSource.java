package com.govcontracts.domain.service;

import java.util.List;

/**
 * Pull-based source of export rows. A batch shorter than {@code limit}
 * marks the end of the data.
 */
@FunctionalInterface
public interface BatchSource<T> {

    List<T> fetch(long offset, int limit);
}
