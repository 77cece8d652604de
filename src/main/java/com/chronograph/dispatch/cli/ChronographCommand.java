package com.chronograph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Chronograph.
 * Routes to subcommands: serve, status, watch, hook.
 */
@Command(
        name = "chronograph",
        mixinStandardHelpOptions = true,
        version = "Chronograph 0.1.0",
        description = "Live observability for multi-agent pipelines",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                WatchCommand.class,
                HookCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ChronographCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
