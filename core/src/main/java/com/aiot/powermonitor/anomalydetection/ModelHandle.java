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

package com.aiot.powermonitor.anomalydetection;

import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiot.powermonitor.exception.InferenceException;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.returntypes.LabelVector;
import com.aiot.powermonitor.returntypes.ScoreVector;

/**
 * Owns the process wide model from the moment it is loaded until it is closed.
 * All requests go through the handle. A model that reports itself as not
 * reentrant is invoked under a single exclusive lock; a reentrant model is
 * invoked without locking.
 */
public class ModelHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelHandle.class);

    private final AnomalyModel model;
    private final String source;
    private final Lock lock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ModelHandle(AnomalyModel model) {
        this(model, model == null ? null : model.getClass().getSimpleName());
    }

    /**
     * @param model  the loaded model; ownership moves to the handle
     * @param source a description of where the model came from, used in logs
     */
    public ModelHandle(AnomalyModel model, String source) {
        this.model = checkNotNull(model, "model must not be null");
        this.source = source;
        this.lock = model.isReentrant() ? null : new ReentrantLock();
    }

    public ScoreVector score(FeatureMatrix features) {
        return invoke(() -> model.score(features));
    }

    public LabelVector label(FeatureMatrix features) {
        return invoke(() -> model.label(features));
    }

    public int getDimensions() {
        return model.getDimensions();
    }

    public String getSource() {
        return source;
    }

    public boolean isSerialized() {
        return lock != null;
    }

    public boolean isClosed() {
        return closed.get();
    }

    private <T> T invoke(Supplier<T> call) {
        if (closed.get()) {
            throw new InferenceException("model " + source + " has been released");
        }
        if (lock == null) {
            return call.get();
        }
        lock.lock();
        try {
            return call.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the model. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            model.close();
            log.info("Released anomaly model {}", source);
        }
    }
}
