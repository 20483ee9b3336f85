package com.inventorysense.engine;

import com.inventorysense.common.DatasetColumns;
import com.inventorysense.engine.model.RawRecord;
import com.inventorysense.engine.model.TimeKey;
import com.inventorysense.engine.time.TimeNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixture builders shared by the engine tests.
 */
public final class TestRecords {

    private static final TimeNormalizer NORMALIZER = new TimeNormalizer();

    private TestRecords() {
    }

    /**
     * A time-keyed record.
     */
    public static RawRecord record(Integer distributorId, String state, String month,
                                   Double deliveries, Double returns, Double waste, Double allowance) {
        TimeKey key = NORMALIZER.normalize(month);
        return new RawRecord(distributorId, state, month, deliveries, returns, waste, allowance, key);
    }

    /**
     * A time-keyed record with deliveries and returns that trigger no return alert.
     */
    public static RawRecord wasteRecord(int distributorId, String state, String month, double waste, double allowance) {
        return record(distributorId, state, month, 1000.0, 10.0, waste, allowance);
    }

    /**
     * One dataset row keyed by the required column names.
     */
    public static Map<String, Object> row(Object distributorId, Object state, Object month,
                                          Object deliveries, Object returns, Object waste, Object allowance) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(DatasetColumns.DISTRIBUTOR_ID, distributorId);
        row.put(DatasetColumns.STATE, state);
        row.put(DatasetColumns.MONTHS, month);
        row.put(DatasetColumns.DELIVERIES, deliveries);
        row.put(DatasetColumns.RETURNS, returns);
        row.put(DatasetColumns.WASTE, waste);
        row.put(DatasetColumns.WASTE_ALLOWANCE, allowance);
        return row;
    }

    /**
     * Three distributors across two states and three quarters of 2023.
     */
    public static List<Map<String, Object>> sampleRows() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row(101, "Texas", "Jan-23", 1000, 50, 60, 50));
        rows.add(row(101, "Texas", "Feb-23", 900, 40, 40, 50));
        rows.add(row(101, "Texas", "Apr-23", 1100, 120, 150, 100));
        rows.add(row(102, "Texas", "Jan-23", 800, 20, 20, 100));
        rows.add(row(102, "Texas", "May-23", 850, 25, 30, 100));
        rows.add(row(103, "Ohio", "Mar-23", 500, 10, 45, 40));
        rows.add(row(103, "Ohio", "Aug-23", 520, 12, 50, 40));
        return rows;
    }
}
