package com.chronograph.dispatch.cli;

import com.chronograph.ChronographApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ChronographCommand chronographCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ChronographCommand chronographCommand, IFactory factory) {
        this.chronographCommand = chronographCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli's execute()
        // would return immediately.
        if (ChronographApplication.isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(chronographCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
