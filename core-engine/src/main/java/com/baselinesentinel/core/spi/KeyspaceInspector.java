package com.baselinesentinel.core.spi;

import com.baselinesentinel.core.model.KeyUsage;

import java.util.List;

/**
 * Point-in-time scan of a key-value store for keys holding too much memory.
 * Implemented by metric sources of cache domains.
 */
public interface KeyspaceInspector {

    /**
     * @param bytes strict lower bound on key size
     * @return keys larger than {@code bytes}, largest first
     * @throws MetricFetchException if the store could not be inspected at all
     */
    List<KeyUsage> findKeysLargerThan(long bytes) throws MetricFetchException;
}
