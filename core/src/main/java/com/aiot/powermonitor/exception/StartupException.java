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
 * Raised when the model artifact cannot be acquired at process start. The
 * {@link Fault} tells an operator whether to look at the file system or at the
 * artifact itself.
 */
public class StartupException extends PowerMonitorException {

    public enum Fault {
        /**
         * the artifact is missing, not a regular file, or unreadable
         */
        FILE_SYSTEM,
        /**
         * the artifact was read but is not a valid model
         */
        MODEL
    }

    private final Fault fault;

    public StartupException(Fault fault, String message) {
        super(ErrorCategory.STARTUP_FAILURE, message);
        this.fault = fault;
    }

    public StartupException(Fault fault, String message, Throwable cause) {
        super(ErrorCategory.STARTUP_FAILURE, message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }
}
