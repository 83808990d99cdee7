package com.stratum.dispatch.cli;

import com.stratum.core.events.ProgressEvent;
import com.stratum.core.events.StratumEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Stratum CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STRATUM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STRATUM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(String fileId, ProgressEvent progress) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "@|fg(blue) [%s]|@ %s %d/%d (line %d)",
                progress.phase().toUpperCase(), fileId, progress.batchesDone(), progress.batchesTotal(),
                progress.currentLine())));
    }

    /** Renders a pipeline event; unknown types are ignored. */
    public static void event(StratumEvent event) {
        switch (event.eventType()) {
            case "file.started" -> info("Processing " + event.fileId());
            case "analysis.progress" -> progress(event.fileId(), ProgressEvent.fromPayload(event.payload()));
            case "container.summarized" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(magenta) [CONTAINER]|@ " + event.payload().get("name")));
            case "reassembly.warning" -> warn(event.fileId() + ": unmatched placeholders "
                    + event.payload().get("unmatchedPlaceholders"));
            default -> {
                // file.completed / file.failed are reported by the commands
            }
        }
    }
}
