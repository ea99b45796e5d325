package com.foreman.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Foreman.
 * Routes to subcommands: run, templates.
 */
@Command(
        name = "foreman",
        mixinStandardHelpOptions = true,
        version = "Foreman 0.1.0",
        description = "Schedules interdependent construction tasks and drives them to completion",
        subcommands = {
                RunCommand.class,
                TemplatesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForemanCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
