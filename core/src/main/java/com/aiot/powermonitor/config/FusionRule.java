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

package com.aiot.powermonitor.config;

/**
 * How the hard signal (some row labelled anomalous by the model) and the soft
 * signal (mean score below the threshold) combine into a warning.
 */
public enum FusionRule {

    /**
     * warn if either signal fires
     */
    ANY {
        @Override
        public boolean isWarning(boolean hardFlag, boolean softFlag) {
            return hardFlag || softFlag;
        }
    },

    /**
     * warn only if both signals fire
     */
    ALL {
        @Override
        public boolean isWarning(boolean hardFlag, boolean softFlag) {
            return hardFlag && softFlag;
        }
    },

    HARD_ONLY {
        @Override
        public boolean isWarning(boolean hardFlag, boolean softFlag) {
            return hardFlag;
        }
    },

    SOFT_ONLY {
        @Override
        public boolean isWarning(boolean hardFlag, boolean softFlag) {
            return softFlag;
        }
    };

    public abstract boolean isWarning(boolean hardFlag, boolean softFlag);
}
