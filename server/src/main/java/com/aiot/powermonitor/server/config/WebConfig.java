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

package com.aiot.powermonitor.server.config;

import java.util.List;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(PowerMonitorProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final PowerMonitorProperties properties;

    public WebConfig(PowerMonitorProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        PowerMonitorProperties.Cors cors = properties.getCors();
        registry.addMapping("/**")
                .allowedOrigins(toArray(cors.getAllowedOrigins()))
                .allowedMethods(toArray(cors.getAllowedMethods()))
                .allowedHeaders("*")
                .allowCredentials(false)
                .maxAge(3600);
    }

    private static String[] toArray(List<String> values) {
        return values.toArray(new String[0]);
    }
}
