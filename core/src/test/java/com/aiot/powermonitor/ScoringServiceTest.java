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

import static com.aiot.powermonitor.TestUtils.EPSILON;
import static com.aiot.powermonitor.TestUtils.readings;
import static com.aiot.powermonitor.returntypes.PointLabel.ANOMALOUS;
import static com.aiot.powermonitor.returntypes.PointLabel.NORMAL;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aiot.powermonitor.anomalydetection.AnomalyModel;
import com.aiot.powermonitor.anomalydetection.ModelHandle;
import com.aiot.powermonitor.exception.ErrorCategory;
import com.aiot.powermonitor.exception.InferenceException;
import com.aiot.powermonitor.exception.ValidationException;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.inputtypes.RawPoint;
import com.aiot.powermonitor.returntypes.LabelVector;
import com.aiot.powermonitor.returntypes.PointLabel;
import com.aiot.powermonitor.returntypes.ScoreVector;
import com.aiot.powermonitor.returntypes.Verdict;
import com.aiot.powermonitor.returntypes.VerdictStatus;
import com.aiot.powermonitor.verdict.VerdictEngine;

@ExtendWith(MockitoExtension.class)
public class ScoringServiceTest {

    @Mock
    private AnomalyModel model;

    private ScoringService service;

    @BeforeEach
    public void setUp() {
        when(model.isReentrant()).thenReturn(true);
        service = new ScoringService(new ModelHandle(model, "mock"), new VerdictEngine());
    }

    private void stub(double[] scores, PointLabel... labels) {
        when(model.getDimensions()).thenReturn(1);
        when(model.score(any())).thenReturn(new ScoreVector(scores));
        when(model.label(any())).thenReturn(new LabelVector(labels));
    }

    @Test
    public void testSpikeProducesWarning() {
        stub(new double[] { 0.3, 0.28, -0.1 }, NORMAL, NORMAL, ANOMALOUS);

        Verdict verdict = service.score(readings(0.5, 0.6, 5.0));

        assertEquals(VerdictStatus.WARNING, verdict.getStatus());
        assertEquals(0.16, verdict.getAverageScore(), EPSILON);
    }

    @Test
    public void testSinglePointNormal() {
        stub(new double[] { 0.2 }, NORMAL);

        Verdict verdict = service.score(readings(0.4));

        assertEquals(VerdictStatus.NORMAL, verdict.getStatus());
        assertEquals(0.2, verdict.getAverageScore());
        assertEquals(VerdictStatus.NORMAL.getMessage(), verdict.getMessage());
    }

    @Test
    public void testModelReceivesRowsInTimestampOrder() {
        stub(new double[] { 0.1, 0.1, 0.1 }, NORMAL, NORMAL, NORMAL);
        List<RawPoint> points = Arrays.asList(new RawPoint("2025-10-16T00:20:00Z", 3.0),
                new RawPoint("2025-10-16T00:00:00Z", 1.0), new RawPoint("2025-10-16T00:10:00Z", 2.0));

        service.score(points);

        ArgumentCaptor<FeatureMatrix> captor = ArgumentCaptor.forClass(FeatureMatrix.class);
        verify(model).score(captor.capture());
        FeatureMatrix matrix = captor.getValue();
        assertEquals(1.0, matrix.get(0, 0));
        assertEquals(2.0, matrix.get(1, 0));
        assertEquals(3.0, matrix.get(2, 0));
    }

    @Test
    public void testRepeatedCallsGiveIdenticalVerdicts() {
        stub(new double[] { 0.12, -0.03, 0.07 }, NORMAL, ANOMALOUS, NORMAL);
        List<RawPoint> points = readings(0.5, 4.0, 0.6);

        Verdict first = service.score(points);
        Verdict second = service.score(new ArrayList<>(points));

        assertEquals(first, second);
        assertEquals(Double.doubleToLongBits(first.getAverageScore()),
                Double.doubleToLongBits(second.getAverageScore()));
    }

    @Test
    public void testEmptyInputNeverReachesModel() {
        ValidationException exception = assertThrows(ValidationException.class,
                () -> service.score(Collections.<RawPoint>emptyList()));
        assertEquals(ErrorCategory.CLIENT_ERROR, exception.getCategory());
        verify(model, never()).score(any());
        verify(model, never()).label(any());
    }

    @Test
    public void testNegativePowerNeverReachesModel() {
        ValidationException exception = assertThrows(ValidationException.class,
                () -> service.score(readings(0.2, -1.0)));
        assertThat(exception.getMessage(), containsString("power must be >= 0"));
        verify(model, never()).score(any());
    }

    @Test
    public void testModelFailureIsWrapped() {
        when(model.getDimensions()).thenReturn(1);
        IllegalStateException failure = new IllegalStateException("boom");
        when(model.score(any())).thenThrow(failure);

        InferenceException exception = assertThrows(InferenceException.class, () -> service.score(readings(0.1)));
        assertEquals(ErrorCategory.SERVER_ERROR, exception.getCategory());
        assertSame(failure, exception.getCause());
    }

    @Test
    public void testOutputArityMismatch() {
        stub(new double[] { 0.1 }, NORMAL, NORMAL);

        InferenceException exception = assertThrows(InferenceException.class,
                () -> service.score(readings(0.1, 0.2)));
        assertThat(exception.getMessage(), containsString("for 2 rows"));
    }

    @Test
    public void testNonFiniteScore() {
        stub(new double[] { Double.NaN }, NORMAL);
        assertThrows(InferenceException.class, () -> service.score(readings(0.1)));
    }

    @Test
    public void testMissingOutput() {
        when(model.getDimensions()).thenReturn(1);
        when(model.score(any())).thenReturn(null);
        assertThrows(InferenceException.class, () -> service.score(readings(0.1)));
    }

    @Test
    public void testFeatureArityMismatch() {
        when(model.getDimensions()).thenReturn(2);
        assertThrows(InferenceException.class, () -> service.score(readings(0.1)));
        verify(model, never()).score(any());
    }

    @Test
    public void testReleasedModel() {
        when(model.getDimensions()).thenReturn(1);
        service.getModel().close();

        InferenceException exception = assertThrows(InferenceException.class, () -> service.score(readings(0.1)));
        assertThat(exception.getMessage(), containsString("released"));
        verify(model).close();
    }

    @Test
    public void testEmptyFeatureMatrix() {
        FeatureMatrix empty = new FeatureMatrix(Collections.singletonList(FeatureMatrix.POWER_COLUMN),
                new double[0][]);
        assertThrows(ValidationException.class, () -> service.score(empty));
    }
}
