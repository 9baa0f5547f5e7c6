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

package com.aiot.powermonitor.serialize;

import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiot.powermonitor.IsolationForest;
import com.aiot.powermonitor.anomalydetection.ModelHandle;
import com.aiot.powermonitor.exception.StartupException;
import com.aiot.powermonitor.exception.StartupException.Fault;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Acquires the model artifact once at process start. Problems with the file
 * itself are reported as {@link Fault#FILE_SYSTEM}; a file that was read but
 * does not hold a valid forest is reported as {@link Fault#MODEL}.
 */
public class ModelArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactLoader.class);

    private final IsolationForestSerDe serDe;

    public ModelArtifactLoader() {
        this(new IsolationForestSerDe());
    }

    public ModelArtifactLoader(IsolationForestSerDe serDe) {
        this.serDe = checkNotNull(serDe, "serDe must not be null");
    }

    /**
     * @param path location of the JSON artifact
     * @return a handle owning the loaded forest
     * @throws StartupException if the artifact cannot be read or is not a valid
     *                          model
     */
    public ModelHandle load(Path path) {
        checkNotNull(path, "path must not be null");
        log.info("Loading anomaly model from {}", path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw failure(Fault.FILE_SYSTEM, "model artifact " + path + " does not exist", null);
        }
        if (!Files.isRegularFile(path)) {
            throw failure(Fault.FILE_SYSTEM, "model artifact " + path + " is not a regular file", null);
        }
        if (!Files.isReadable(path)) {
            throw failure(Fault.FILE_SYSTEM, "model artifact " + path + " is not readable", null);
        }

        String json;
        try {
            json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw failure(Fault.FILE_SYSTEM, "failed to read model artifact " + path, e);
        }

        IsolationForest forest;
        try {
            forest = serDe.fromJson(json);
        } catch (JsonProcessingException e) {
            throw failure(Fault.MODEL, "model artifact " + path + " is not valid JSON: " + e.getOriginalMessage(),
                    e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw failure(Fault.MODEL, "model artifact " + path + " is not a valid model: " + e.getMessage(), e);
        }

        log.info("Loaded anomaly model from {}: dimensions={}, trees={}, sampleSize={}, offset={}", path,
                forest.getDimensions(), forest.getNumberOfTrees(), forest.getSampleSize(), forest.getOffset());
        return new ModelHandle(forest, path.toString());
    }

    public IsolationForestSerDe getSerDe() {
        return serDe;
    }

    private StartupException failure(Fault fault, String message, Throwable cause) {
        log.error("Unable to load anomaly model ({}): {}", fault, message);
        return cause == null ? new StartupException(fault, message) : new StartupException(fault, message, cause);
    }
}
