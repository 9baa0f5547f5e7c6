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

package com.aiot.powermonitor.server;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.aiot.powermonitor.IsolationForest;
import com.aiot.powermonitor.returntypes.VerdictStatus;
import com.aiot.powermonitor.serialize.IsolationForestSerDe;
import com.aiot.powermonitor.testutils.PowerConsumptionSimulator;
import com.aiot.powermonitor.testutils.SimulatedPowerData;

@SpringBootTest
@AutoConfigureMockMvc
public class PowerMonitorApplicationTest {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final SimulatedPowerData DATA = new PowerConsumptionSimulator().generate(7L);

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void modelArtifact(DynamicPropertyRegistry registry) throws IOException {
        Path directory = Files.createTempDirectory("powermonitor");
        directory.toFile().deleteOnExit();
        Path artifact = directory.resolve("anomaly_detector.json");
        IsolationForest forest = IsolationForest.builder().numberOfTrees(50).contamination(0.05).randomSeed(42)
                .fit(DATA.toRows());
        new IsolationForestSerDe().write(forest, artifact);
        artifact.toFile().deleteOnExit();
        registry.add("powermonitor.model.path", artifact::toString);
    }

    @Test
    public void testSpikeProducesWarning() throws Exception {
        StringBuilder body = new StringBuilder("{\"time_series\": [");
        for (int i = 0; i < 6; i++) {
            body.append(reading(i, DATA.getPower()[i])).append(',');
        }
        body.append(reading(6, 12.0)).append("]}");

        mockMvc.perform(post("/predict_anomaly").contentType(MediaType.APPLICATION_JSON).content(body.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Warning"))
                .andExpect(jsonPath("$.message").value(VerdictStatus.WARNING.getMessage()))
                .andExpect(jsonPath("$.average_anomaly_score").isNumber());
    }

    @Test
    public void testNegativePowerIsRejected() throws Exception {
        String body = "{\"time_series\": [" + reading(0, 0.3) + "," + reading(1, -0.2) + "]}";

        mockMvc.perform(post("/predict_anomaly").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("CLIENT_ERROR"));
    }

    @Test
    public void testInvalidTimestampIsRejected() throws Exception {
        String body = "{\"time_series\": [{\"timestamp\": \"yesterday\", \"power_kW\": 0.3}]}";

        mockMvc.perform(post("/predict_anomaly").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("CLIENT_ERROR"));
    }

    private static String reading(int index, double power) {
        return String.format("{\"timestamp\": \"%s\", \"power_kW\": %s}", DATA.getTimestamps().get(index).format(FORMAT),
                Double.toString(power));
    }
}
