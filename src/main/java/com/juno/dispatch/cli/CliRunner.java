package com.juno.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the Juno command line inside the Spring Boot lifecycle and hands its
 * exit code back to Boot. An exception escaping a command is printed as a
 * one-line error and exits {@value #EXIT_FAILURE}, like a failed run.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;

    private final JunoCommand junoCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(JunoCommand junoCommand, IFactory factory) {
        this.junoCommand = junoCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        return new CommandLine(junoCommand, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + rootMessage(e));
                    return EXIT_FAILURE;
                });
    }

    static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
