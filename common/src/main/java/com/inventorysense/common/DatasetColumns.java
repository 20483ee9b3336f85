package com.inventorysense.common;

import java.util.List;

/**
 * Column names of the distributor transaction dataset handed over by the upload boundary.
 */
public final class DatasetColumns {

    public static final String DISTRIBUTOR_ID = "Distributor ID";
    public static final String STATE = "US States";
    public static final String MONTHS = "Months";
    public static final String DELIVERIES = "Deliveries_Quantity";
    public static final String RETURNS = "Returns_Quantity";
    public static final String WASTE_ALLOWANCE = "Waste_Allowance_Quantity";
    public static final String WASTE = "Waste_Quantity_Sum";

    /**
     * Columns every aggregation over the dataset depends on.
     */
    public static final List<String> REQUIRED = List.of(
        DISTRIBUTOR_ID,
        STATE,
        MONTHS,
        DELIVERIES,
        RETURNS,
        WASTE_ALLOWANCE,
        WASTE
    );

    private DatasetColumns() {
    }
}
