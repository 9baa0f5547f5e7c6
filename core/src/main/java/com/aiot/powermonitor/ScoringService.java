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

package com.aiot.powermonitor;

import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiot.powermonitor.anomalydetection.ModelHandle;
import com.aiot.powermonitor.exception.InferenceException;
import com.aiot.powermonitor.exception.ValidationException;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.inputtypes.RawPoint;
import com.aiot.powermonitor.returntypes.LabelVector;
import com.aiot.powermonitor.returntypes.ScoreVector;
import com.aiot.powermonitor.returntypes.Verdict;
import com.aiot.powermonitor.validation.TimeSeriesValidator;
import com.aiot.powermonitor.verdict.VerdictEngine;

/**
 * Scores one power consumption series per call: validation, feature
 * extraction, inference and the verdict. The service keeps no state between
 * calls; the model handle it is given is the only shared object and is only
 * read.
 *
 * Input that fails validation raises {@link ValidationException} before the
 * model is invoked. Any failure of the model, including output that does not
 * line up with the input, raises {@link InferenceException}; no partial verdict
 * is produced and nothing is retried.
 */
public class ScoringService {

    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    private final TimeSeriesValidator validator;
    private final ModelHandle model;
    private final VerdictEngine verdictEngine;

    public ScoringService(ModelHandle model, VerdictEngine verdictEngine) {
        this(new TimeSeriesValidator(), model, verdictEngine);
    }

    public ScoringService(TimeSeriesValidator validator, ModelHandle model, VerdictEngine verdictEngine) {
        this.validator = checkNotNull(validator, "validator must not be null");
        this.model = checkNotNull(model, "model must not be null");
        this.verdictEngine = checkNotNull(verdictEngine, "verdictEngine must not be null");
    }

    /**
     * @param rawPoints readings in any order
     * @return the verdict for the readings
     * @throws ValidationException if the readings are empty or invalid
     * @throws InferenceException  if the model fails
     */
    public Verdict score(List<RawPoint> rawPoints) {
        FeatureMatrix features;
        try {
            features = validator.toFeatureMatrix(rawPoints);
        } catch (ValidationException e) {
            log.warn("Rejected time series: {}", e.getMessage());
            throw e;
        }
        return score(features);
    }

    /**
     * Scores an already validated feature matrix.
     *
     * @param features rows in timestamp order
     * @return the verdict for the rows
     * @throws InferenceException if the model fails
     */
    public Verdict score(FeatureMatrix features) {
        checkNotNull(features, "features must not be null");
        int rows = features.getNumberOfRows();
        if (rows == 0) {
            throw new ValidationException("time series must contain at least one point");
        }
        if (features.getNumberOfColumns() != model.getDimensions()) {
            throw inferenceFailure(String.format("model expects %d features per row but received %d",
                    model.getDimensions(), features.getNumberOfColumns()), null);
        }

        ScoreVector scores;
        LabelVector labels;
        try {
            scores = model.score(features);
            labels = model.label(features);
        } catch (InferenceException e) {
            log.warn("Model inference failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw inferenceFailure("model inference failed: " + e.getMessage(), e);
        }

        if (scores == null || labels == null) {
            throw inferenceFailure("model returned no output", null);
        }
        if (scores.size() != rows || labels.size() != rows) {
            throw inferenceFailure(String.format("model returned %d scores and %d labels for %d rows", scores.size(),
                    labels.size(), rows), null);
        }
        if (!scores.isFinite()) {
            throw inferenceFailure("model returned a non-finite score", null);
        }

        Verdict verdict = verdictEngine.decide(scores, labels);
        log.debug("Scored {} points: status={}, averageScore={}, hardAnomalies={}", rows,
                verdict.getStatus().getLabel(), verdict.getAverageScore(), labels.countAnomalies());
        return verdict;
    }

    public VerdictEngine getVerdictEngine() {
        return verdictEngine;
    }

    public ModelHandle getModel() {
        return model;
    }

    private InferenceException inferenceFailure(String message, Throwable cause) {
        log.warn("Model inference failed: {}", message);
        return cause == null ? new InferenceException(message) : new InferenceException(message, cause);
    }
}
