package com.juno.dispatch.cli;

import com.juno.core.config.JunoProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: juno targets
 */
@Command(name = "targets", mixinStandardHelpOptions = true, description = "Show the configured performance targets")
@Component
public class TargetsCommand implements Runnable {

    private final JunoProperties properties;

    public TargetsCommand(JunoProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var targets = properties.initialTargets();
        if (targets.isEmpty()) {
            ConsoleOutput.info("No performance targets configured.");
            return;
        }
        targets.forEach(ConsoleOutput::target);
    }
}
