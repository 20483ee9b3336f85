package com.inventorysense.engine.model;

import com.inventorysense.common.DatasetColumns;
import com.inventorysense.engine.util.Numbers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Row-oriented table handed over by the upload boundary.
 * Column names are trimmed; column order follows first appearance across rows.
 * Instances are immutable.
 */
public final class RawDataset {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private RawDataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static RawDataset of(List<Map<String, Object>> sourceRows) {
        Set<String> columnNames = new LinkedHashSet<>();
        List<Map<String, Object>> copied = new ArrayList<>(sourceRows.size());
        for (Map<String, Object> sourceRow : sourceRows) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (sourceRow != null) {
                sourceRow.forEach((column, value) -> {
                    String name = column.trim();
                    columnNames.add(name);
                    row.put(name, value);
                });
            }
            copied.add(Collections.unmodifiableMap(row));
        }
        return new RawDataset(List.copyOf(columnNames), Collections.unmodifiableList(copied));
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * Columns whose present values are all numbers, with at least one value present.
     */
    public List<String> numericColumns() {
        List<String> numeric = new ArrayList<>();
        for (String column : columns) {
            boolean seenValue = false;
            boolean allNumbers = true;
            for (Map<String, Object> row : rows) {
                Object value = row.get(column);
                if (value == null) {
                    continue;
                }
                seenValue = true;
                if (!(value instanceof Number) || Numbers.toDouble(value) == null) {
                    allNumbers = false;
                    break;
                }
            }
            if (seenValue && allNumbers) {
                numeric.add(column);
            }
        }
        return numeric;
    }

    /**
     * Values of a column as doubles, {@code null} where missing or not numeric.
     */
    public List<Double> numericValues(String column) {
        List<Double> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(Numbers.toDouble(row.get(column)));
        }
        return values;
    }

    /**
     * Typed projection of every row. Time keys are left unset.
     */
    public List<RawRecord> records() {
        List<RawRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object state = row.get(DatasetColumns.STATE);
            Object month = row.get(DatasetColumns.MONTHS);
            records.add(new RawRecord(
                Numbers.toInteger(row.get(DatasetColumns.DISTRIBUTOR_ID)),
                state != null ? state.toString() : null,
                month != null ? month.toString() : null,
                Numbers.toDouble(row.get(DatasetColumns.DELIVERIES)),
                Numbers.toDouble(row.get(DatasetColumns.RETURNS)),
                Numbers.toDouble(row.get(DatasetColumns.WASTE)),
                Numbers.toDouble(row.get(DatasetColumns.WASTE_ALLOWANCE)),
                null
            ));
        }
        return records;
    }
}
