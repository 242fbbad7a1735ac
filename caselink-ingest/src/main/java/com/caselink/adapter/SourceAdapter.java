package com.caselink.adapter;

import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.NormalizedCase;

import java.util.List;

/**
 * Connector for one external source. {@code R} is the source's own raw record
 * shape; {@link #normalize} maps it to the shared {@link NormalizedCase}.
 *
 * @param <R> raw record type returned by {@link #fetch}
 */
public interface SourceAdapter<R> {

    CaseSource source();

    String sourceName();

    /** Default polling interval, used for the data source row and schedules. */
    int pollingIntervalMinutes();

    default String apiType() {
        return "rest";
    }

    /**
     * Fetch raw records page by page. A page that fails after its retries ends
     * pagination; records from earlier pages are still returned.
     */
    List<R> fetch(FetchOptions options);

    /**
     * Map one raw record. Performs no I/O. Fields that cannot be parsed are
     * left null.
     *
     * @throws com.caselink.exception.NormalizationException if the record has no usable identity
     */
    NormalizedCase normalize(R raw);

    /**
     * Issue one lightweight request against the upstream.
     *
     * @throws com.caselink.exception.FetchException if the upstream is unreachable
     */
    void probe();
}
