package com.earlywarning.analyzer.history;

import java.util.List;

/**
 * Storage for scan records and the aggregates dashboards read.
 *
 * <p>
 * Owned by the API layer. The analysis engine never reads or writes it.
 * </p>
 *
 * @author Naveed Gung
 */
public interface ScanRecordStore {

    ScanRecord save(ScanRecord record);

    /** Newest first, at most {@code limit} records. */
    List<ScanRecord> recent(int limit);

    /** @return true if a record with that id existed */
    boolean delete(String id);

    ScanSummary summary();

    /** Number of records currently held. */
    int size();
}
