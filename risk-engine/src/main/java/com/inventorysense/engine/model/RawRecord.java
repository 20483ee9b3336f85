package com.inventorysense.engine.model;

/**
 * One transactional row of the distributor dataset.
 * Measures are {@code null} when the source cell was missing or not numeric;
 * {@code timeKey} is {@code null} until normalized or when the month label is unparseable.
 */
public record RawRecord(
    Integer distributorId,
    String state,
    String monthLabel,
    Double deliveries,
    Double returns,
    Double waste,
    Double wasteAllowance,
    TimeKey timeKey
) {
    /**
     * Records without a distributor or state never take part in an aggregation.
     */
    public boolean isKeyed() {
        return distributorId != null && state != null;
    }

    public RawRecord withTimeKey(TimeKey key) {
        return new RawRecord(distributorId, state, monthLabel, deliveries, returns, waste, wasteAllowance, key);
    }
}
