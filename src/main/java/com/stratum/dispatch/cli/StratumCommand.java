package com.stratum.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Stratum.
 * Routes to subcommands: analyze, convert.
 */
@Command(
        name = "stratum",
        mixinStandardHelpOptions = true,
        version = "Stratum 0.1.0",
        description = "Batch annotation and conversion of parsed source trees",
        subcommands = {
                AnalyzeCommand.class,
                ConvertCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StratumCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
