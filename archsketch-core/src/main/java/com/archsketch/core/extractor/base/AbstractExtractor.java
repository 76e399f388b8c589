package com.archsketch.core.extractor.base;

import com.archsketch.core.extractor.TreeExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Base class for extractors.
 *
 * <p>Provides a per-class logger and uniform debug logging of extraction counts.
 *
 * @param <T> type of record produced
 */
public abstract class AbstractExtractor<T> implements TreeExtractor<T> {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Logs the number of extracted records and returns them unchanged.
     *
     * @param records extracted records
     * @return the same records, as an immutable list
     */
    protected List<T> finish(List<T> records) {
        if (log.isDebugEnabled()) {
            log.debug("{} extracted {} record(s)", getId(), records.size());
        }
        return List.copyOf(records);
    }

    @Override
    public String toString() {
        return getDisplayName() + " (" + getId() + ")";
    }
}
