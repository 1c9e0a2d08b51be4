package com.automaker.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "automaker",
        mixinStandardHelpOptions = true,
        version = "Automaker 0.1.0",
        description = "Autonomous feature execution for your projects",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                WatchCommand.class,
                ApproveCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AutomakerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
