package com.parallax.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Parallax.
 * Routes to subcommands: run, plan, resume.
 */
@Command(
        name = "parallax",
        mixinStandardHelpOptions = true,
        version = "Parallax 0.1.0",
        description = "Runs free-text development tasks in parallel isolated workspaces and merges them serially",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                ResumeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ParallaxCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
