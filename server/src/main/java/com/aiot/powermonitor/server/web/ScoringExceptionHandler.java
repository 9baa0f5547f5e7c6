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

package com.aiot.powermonitor.server.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.aiot.powermonitor.exception.ErrorCategory;
import com.aiot.powermonitor.exception.PowerMonitorException;
import com.aiot.powermonitor.server.web.dto.ErrorResponse;

/**
 * Maps pipeline failures to the error body returned to clients. The status
 * code follows the exception's {@link ErrorCategory}.
 */
@RestControllerAdvice
public class ScoringExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ScoringExceptionHandler.class);

    @ExceptionHandler(PowerMonitorException.class)
    public ResponseEntity<ErrorResponse> handlePowerMonitorException(PowerMonitorException e) {
        ErrorCategory category = e.getCategory();
        log.warn("Request failed with {}: {}", category, e.getMessage());
        return respond(category, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(ErrorCategory.CLIENT_ERROR, "request body is not a valid time series document");
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorCategory category, String detail) {
        return ResponseEntity.status(HttpStatus.valueOf(category.getHttpStatus()))
                .body(new ErrorResponse(category, detail));
    }
}
