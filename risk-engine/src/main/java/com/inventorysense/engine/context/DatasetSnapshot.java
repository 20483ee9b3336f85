package com.inventorysense.engine.context;

import com.inventorysense.engine.model.DistributorQuarterAggregate;
import com.inventorysense.engine.model.RawDataset;
import com.inventorysense.engine.model.RawRecord;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of one uploaded dataset and everything derived from it at upload time.
 *
 * @param version monotonically increasing upload counter
 * @param loadedAt when the snapshot was published
 * @param dataset the raw table as uploaded
 * @param records typed records annotated with time keys
 * @param distributorQuarters the distributor-quarter table
 */
public record DatasetSnapshot(
    long version,
    Instant loadedAt,
    RawDataset dataset,
    List<RawRecord> records,
    List<DistributorQuarterAggregate> distributorQuarters
) {
    public DatasetSnapshot {
        records = List.copyOf(records);
        distributorQuarters = List.copyOf(distributorQuarters);
    }
}
