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
 * How a failure is reported to whoever invoked the pipeline.
 */
public enum ErrorCategory {

    /**
     * The caller supplied input outside of the contract; HTTP 400.
     */
    CLIENT_ERROR(400),

    /**
     * The model failed while scoring valid input; HTTP 500.
     */
    SERVER_ERROR(500),

    /**
     * The model could not be acquired; the process must not start serving.
     */
    STARTUP_FAILURE(503);

    private final int httpStatus;

    ErrorCategory(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
