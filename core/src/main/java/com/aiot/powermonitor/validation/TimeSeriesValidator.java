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

package com.aiot.powermonitor.validation;

import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.aiot.powermonitor.exception.ValidationException;
import com.aiot.powermonitor.inputtypes.DataPoint;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.inputtypes.RawPoint;
import com.aiot.powermonitor.inputtypes.TimeSeries;

/**
 * Turns caller supplied readings into a {@link TimeSeries} sorted by timestamp
 * and the {@link FeatureMatrix} derived from it.
 *
 * A request is either accepted as a whole or rejected as a whole: the first
 * point with a missing, negative or non-finite power value, or with a missing or
 * unparseable timestamp, fails the request with a {@link ValidationException}.
 * No point is dropped or clamped. Readings are not required to arrive in order;
 * they are sorted ascending by timestamp with a stable sort, so readings that
 * share a timestamp keep the order in which they were supplied.
 */
public class TimeSeriesValidator {

    private final TimestampParser timestampParser;

    public TimeSeriesValidator() {
        this(new TimestampParser());
    }

    public TimeSeriesValidator(TimestampParser timestampParser) {
        this.timestampParser = checkNotNull(timestampParser, "timestampParser must not be null");
    }

    /**
     * Validates the readings and orders them by time.
     *
     * @param rawPoints readings in caller order
     * @return the readings as a time series sorted by timestamp
     * @throws ValidationException if the input is empty or any reading is invalid
     */
    public TimeSeries validate(List<RawPoint> rawPoints) {
        if (rawPoints == null || rawPoints.isEmpty()) {
            throw new ValidationException("time series must contain at least one point");
        }

        List<DataPoint> points = new ArrayList<>(rawPoints.size());
        for (int i = 0; i < rawPoints.size(); i++) {
            points.add(toDataPoint(rawPoints.get(i), i));
        }

        // List.sort is stable
        points.sort(Comparator.comparing(DataPoint::getTimestamp));
        return new TimeSeries(points);
    }

    /**
     * Validates the readings and extracts the feature matrix the model consumes.
     *
     * @param rawPoints readings in caller order
     * @return one row per reading, in timestamp order
     * @throws ValidationException if the input is empty or any reading is invalid
     */
    public FeatureMatrix toFeatureMatrix(List<RawPoint> rawPoints) {
        return FeatureMatrix.ofPower(validate(rawPoints));
    }

    DataPoint toDataPoint(RawPoint raw, int index) {
        if (raw == null) {
            throw new ValidationException(String.format("point %d is missing", index), index);
        }

        Double power = raw.getPower();
        if (power == null) {
            throw new ValidationException(String.format("point %d has no power value", index), index);
        }
        if (!Double.isFinite(power)) {
            throw new ValidationException(String.format("point %d has a non-finite power value %s", index, power),
                    index);
        }
        if (power < 0) {
            throw new ValidationException(
                    String.format("point %d has a negative power value %s; power must be >= 0", index, power), index);
        }

        String text = raw.getTimestamp();
        if (text == null || text.isBlank()) {
            throw new ValidationException(String.format("point %d has no timestamp", index), index);
        }
        Instant timestamp;
        try {
            timestamp = timestampParser.parse(text);
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    String.format("point %d has a timestamp '%s' that is not ISO-8601: %s", index, text, e.getMessage()),
                    index, e);
        }
        return new DataPoint(timestamp, power);
    }
}
