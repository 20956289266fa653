/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.catchup;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the current state of the watched tables, used to replay changes that were not observed live.
 */
public interface HistoricalStore {

    /**
     * Fetch the rows of a table that were created or modified after the watermark, in ascending order of change time.
     *
     * @param table the table name; may not be null
     * @param watermark the exclusive lower bound; may not be null
     * @param limit the maximum number of rows; positive
     * @return the rows; never null
     * @throws io.syncbase.SyncbaseException if the rows could not be read
     */
    List<HistoricalRow> fetchChangedSince(String table, Instant watermark, int limit);

    /**
     * Abort every read currently in progress. Aborted reads fail; later reads are not affected.
     */
    void cancel();
}
