/**
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.c3ds.application;

import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

/**
 * The root command of the C3DS device authenticator.
 *
 */
@CommandLine.Command(
        name = "c3ds",
        description = { "Issues X.509 certificates to devices and authenticates the messages they send." },
        mixinStandardHelpOptions = true,
        versionProvider = PropertiesVersionProvider.class,
        subcommands = { ServeCommand.class, CreateCaCommand.class })
public class Application implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(Application.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    /**
     * Creates the command line for the application's commands.
     *
     * @return The command line.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new Application())
                .setExecutionExceptionHandler(Application::handleExecutionException);
    }

    /**
     * Runs a command.
     * <p>
     * The JVM keeps running after the <em>serve</em> command has started the server successfully.
     *
     * @param args The command line arguments.
     */
    public static void main(final String[] args) {
        final int exitCode = commandLine().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Handles an error that occurred while executing a command.
     *
     * @param ex The error.
     * @param commandLine The command's command line.
     * @param parseResult The result of parsing the command line.
     * @return Always 1.
     */
    static int handleExecutionException(
            final Exception ex,
            final CommandLine commandLine,
            final ParseResult parseResult) {

        final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        LOG.debug("error executing command", cause);
        commandLine.getErr().printf("Error: %s%n", cause.getMessage());
        return 1;
    }
}
