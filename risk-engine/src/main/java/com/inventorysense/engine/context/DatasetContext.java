package com.inventorysense.engine.context;

import com.inventorysense.engine.aggregate.DistributorQuarterAggregator;
import com.inventorysense.engine.errors.DatasetNotLoadedException;
import com.inventorysense.engine.model.DistributorQuarterAggregate;
import com.inventorysense.engine.model.RawDataset;
import com.inventorysense.engine.model.RawRecord;
import com.inventorysense.engine.time.TimeNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current dataset snapshot.
 *
 * <p>Uploads build a complete new snapshot and publish it with a single reference swap;
 * a failed build leaves the previous snapshot in place. Readers take one snapshot via
 * {@link #current()} and compute from it for the whole request, so they never observe
 * a partially replaced dataset and never block.
 */
public class DatasetContext {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetContext.class);

    private final AtomicReference<DatasetSnapshot> snapshot = new AtomicReference<>();
    private final TimeNormalizer timeNormalizer;
    private final DistributorQuarterAggregator aggregator;

    public DatasetContext() {
        this(new TimeNormalizer(), new DistributorQuarterAggregator());
    }

    public DatasetContext(TimeNormalizer timeNormalizer, DistributorQuarterAggregator aggregator) {
        this.timeNormalizer = timeNormalizer;
        this.aggregator = aggregator;
    }

    /**
     * Replace the dataset. Serialized so versions are published in order.
     *
     * @return the published snapshot
     * @throws com.inventorysense.engine.errors.SchemaException if required columns are missing
     */
    public synchronized DatasetSnapshot replace(RawDataset dataset) {
        LOG.info("Building snapshot from {} rows and {} columns", dataset.size(), dataset.columns().size());
        List<RawRecord> records = timeNormalizer.normalize(dataset.records());
        List<DistributorQuarterAggregate> table = aggregator.aggregate(dataset.columns(), records);

        DatasetSnapshot previous = snapshot.get();
        long version = previous == null ? 1 : previous.version() + 1;
        DatasetSnapshot next = new DatasetSnapshot(version, Instant.now(), dataset, records, table);
        snapshot.set(next);

        LOG.info("Published dataset snapshot v{} ({} distributor-quarter rows)", version, table.size());
        return next;
    }

    /**
     * @throws DatasetNotLoadedException if nothing has been uploaded
     */
    public DatasetSnapshot current() {
        DatasetSnapshot current = snapshot.get();
        if (current == null) {
            throw new DatasetNotLoadedException();
        }
        return current;
    }

    public Optional<DatasetSnapshot> peek() {
        return Optional.ofNullable(snapshot.get());
    }
}
