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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An ordered, non-empty sequence of {@link DataPoint}s. The order is the order
 * in which the points were supplied to the constructor; the validator supplies
 * them sorted by timestamp.
 */
@ToString
@EqualsAndHashCode
public class TimeSeries implements Iterable<DataPoint> {

    private final List<DataPoint> points;

    public TimeSeries(List<DataPoint> points) {
        checkNotNull(points, "points must not be null");
        checkArgument(!points.isEmpty(), "a time series must contain at least one point");
        for (DataPoint point : points) {
            checkNotNull(point, "points must not contain null");
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public int size() {
        return points.size();
    }

    public DataPoint get(int index) {
        return points.get(index);
    }

    public List<DataPoint> getPoints() {
        return points;
    }

    @Override
    public Iterator<DataPoint> iterator() {
        return points.iterator();
    }
}
