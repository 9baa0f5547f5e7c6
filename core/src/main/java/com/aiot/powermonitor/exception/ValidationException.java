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

package com.aiot.powermonitor.exception;

/**
 * Raised when a caller supplied series is empty, or contains a point with a
 * missing, negative or non-finite power value, or a timestamp that cannot be
 * parsed.
 */
public class ValidationException extends PowerMonitorException {

    private final int pointIndex;

    public ValidationException(String message) {
        this(message, -1, null);
    }

    public ValidationException(String message, int pointIndex) {
        this(message, pointIndex, null);
    }

    public ValidationException(String message, int pointIndex, Throwable cause) {
        super(ErrorCategory.CLIENT_ERROR, message, cause);
        this.pointIndex = pointIndex;
    }

    /**
     * @return the position of the offending point in the caller's input, or -1 if
     *         the failure is not tied to a single point
     */
    public int getPointIndex() {
        return pointIndex;
    }
}
