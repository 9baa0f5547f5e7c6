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

package com.aiot.powermonitor.trainer;

import java.io.PrintStream;

import com.aiot.powermonitor.trainer.runner.ArgumentParser;

/**
 * A sub-command of the trainer tool.
 *
 * @param <A> the parser for the arguments of the command
 */
public interface Command<A extends ArgumentParser> {

    String command();

    String description();

    A newArgumentParser();

    /**
     * @param arguments parsed arguments
     * @param out       destination of the human readable report
     */
    void run(A arguments, PrintStream out) throws Exception;
}
