package com.juno.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Juno.
 * Routes to subcommands: run, targets, help.
 */
@Command(
        name = "juno",
        mixinStandardHelpOptions = true,
        version = "Juno 0.1.0",
        description = "Hierarchical agent teams that grade, scale and improve themselves",
        subcommands = {
                RunCommand.class,
                TargetsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class JunoCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
