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
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Getter;

import com.aiot.powermonitor.IsolationForest;
import com.aiot.powermonitor.state.IsolationForestMapper;
import com.aiot.powermonitor.state.IsolationForestState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link IsolationForest} serialization. Internally we use the
 * {@link IsolationForestMapper} class to convert a forest into a corresponding
 * state object, and we use <a href="https://github.com/FasterXML/jackson">Jackson</a>
 * to write the state object as a JSON string. The object mapper is exposed so
 * users can customize the output (e.g., by enabling pretty printing).
 */
@Getter
public class IsolationForestSerDe {

    private final IsolationForestMapper mapper;
    private final ObjectMapper objectMapper;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public IsolationForestSerDe() {
        this(new IsolationForestMapper(), new ObjectMapper());
    }

    /**
     * @param mapper       converts a forest to a state object and back
     * @param objectMapper writes and reads the JSON form of the state object
     */
    public IsolationForestSerDe(IsolationForestMapper mapper, ObjectMapper objectMapper) {
        this.mapper = checkNotNull(mapper, "mapper must not be null");
        this.objectMapper = checkNotNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Serializes a forest to a JSON string.
     *
     * @param forest a trained forest
     * @return the JSON form of its state
     */
    public String toJson(IsolationForest forest) {
        try {
            return objectMapper.writeValueAsString(mapper.toState(forest));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes a JSON string produced by {@link #toJson}.
     *
     * @param json the JSON form of a forest state
     * @return the forest
     * @throws JsonProcessingException  if the text is not a JSON forest state
     * @throws IllegalArgumentException if the state does not describe a valid
     *                                  forest
     */
    public IsolationForest fromJson(String json) throws JsonProcessingException {
        return mapper.toModel(parse(json));
    }

    /**
     * @param json the JSON form of a forest state
     * @param seed a random seed value used to initialize the forest
     * @return the forest
     */
    public IsolationForest fromJson(String json, long seed) throws JsonProcessingException {
        return mapper.toModel(parse(json), seed);
    }

    public IsolationForestState parse(String json) throws JsonProcessingException {
        checkNotNull(json, "json must not be null");
        IsolationForestState state = objectMapper.readValue(json, IsolationForestState.class);
        if (state == null) {
            throw new IllegalArgumentException("the document does not contain a model");
        }
        return state;
    }

    /**
     * Writes the forest to a UTF-8 JSON file, replacing any existing file.
     */
    public void write(IsolationForest forest, Path path) throws IOException {
        checkNotNull(path, "path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, toJson(forest).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Reads a forest written by {@link #write}.
     *
     * @throws IOException              if the file cannot be read or is not a JSON
     *                                  forest state
     * @throws IllegalArgumentException if the state does not describe a valid
     *                                  forest
     */
    public IsolationForest read(Path path) throws IOException {
        checkNotNull(path, "path must not be null");
        return fromJson(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }
}
