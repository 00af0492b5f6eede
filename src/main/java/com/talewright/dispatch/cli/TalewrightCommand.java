package com.talewright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Talewright.
 * Routes to subcommands: generate, status, watch, serve.
 */
@Command(
        name = "talewright",
        mixinStandardHelpOptions = true,
        version = "Talewright 0.1.0",
        description = "Multi-agent narrative generation engine",
        subcommands = {
                GenerateCommand.class,
                StatusCommand.class,
                WatchCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TalewrightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
