/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.aiot.powermonitor.inputtypes;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The numeric input of an anomaly model: one row per reading, one column per
 * feature. If we think of a time series as a list of readings, this is the
 * column oriented view of it that the model consumes. Rows are copied on the
 * way in and on the way out, so a matrix never changes after construction.
 */
public class FeatureMatrix {

    /**
     * Name of the only feature extracted from a power reading.
     */
    public static final String POWER_COLUMN = "power_kW";

    private final List<String> columnNames;
    private final double[][] rows;

    public FeatureMatrix(List<String> columnNames, double[][] rows) {
        checkNotNull(columnNames, "columnNames must not be null");
        checkNotNull(rows, "rows must not be null");
        checkArgument(!columnNames.isEmpty(), "a feature matrix needs at least one column");
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.rows = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            checkNotNull(rows[i], "rows must not contain null");
            checkArgument(rows[i].length == columnNames.size(),
                    String.format("row %d has %d values, expected %d", i, rows[i].length, columnNames.size()));
            this.rows[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
    }

    /**
     * Builds the single column matrix of power values, in the order of the series.
     *
     * @param series a validated time series
     * @return a matrix with one {@value #POWER_COLUMN} column
     */
    public static FeatureMatrix ofPower(TimeSeries series) {
        checkNotNull(series, "series must not be null");
        double[][] rows = new double[series.size()][];
        for (int i = 0; i < series.size(); i++) {
            rows[i] = new double[] { series.get(i).getPower() };
        }
        return new FeatureMatrix(Collections.singletonList(POWER_COLUMN), rows);
    }

    public int getNumberOfRows() {
        return rows.length;
    }

    public int getNumberOfColumns() {
        return columnNames.size();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public double[] getRow(int index) {
        return Arrays.copyOf(rows[index], rows[index].length);
    }

    public double get(int row, int column) {
        return rows[row][column];
    }

    /**
     * @return a deep copy of all rows
     */
    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
        return copy;
    }
}
