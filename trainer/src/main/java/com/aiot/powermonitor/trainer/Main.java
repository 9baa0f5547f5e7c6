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
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiot.powermonitor.trainer.runner.ArgumentParser;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int status = new Main().run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    private final Map<String, Command<?>> commands;
    private int maxCommandLength;

    public Main() {
        commands = new TreeMap<>();
        maxCommandLength = 0;
        add(new SimulateCommand());
        add(new TrainCommand());
    }

    private void add(Command<?> command) {
        commands.put(command.command(), command);
        if (maxCommandLength < command.command().length()) {
            maxCommandLength = command.command().length();
        }
    }

    /**
     * @return the process exit status
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(out);
            return 0;
        }

        Command<?> command = commands.get(args[0]);
        if (command == null) {
            err.println("Error: No such command: " + args[0]);
            printUsage(err);
            return 1;
        }

        return execute(command, Arrays.copyOfRange(args, 1, args.length), out, err);
    }

    private <A extends ArgumentParser> int execute(Command<A> command, String[] args, PrintStream out,
            PrintStream err) {
        A arguments = command.newArgumentParser();
        try {
            arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            arguments.printUsage(err);
            return 1;
        }
        if (arguments.isHelpRequested()) {
            arguments.printUsage(out);
            return 0;
        }

        try {
            command.run(arguments, out);
            return 0;
        } catch (Exception e) {
            log.error("Command {} failed", command.command(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    public void printUsage(PrintStream out) {
        out.printf("Usage: java -jar %s [command] [options]%n", ArgumentParser.ARCHIVE_NAME);
        out.println("Commands:");
        String formatString = String.format("\t %%%ds - %%s%%n", maxCommandLength);
        for (Command<?> command : commands.values()) {
            out.printf(formatString, command.command(), command.description());
        }
    }
}
