package com.stratum.dispatch.cli;

import com.stratum.core.events.EventBus;
import com.stratum.core.pipeline.ConversionPipeline;
import com.stratum.core.pipeline.ConversionResult;
import com.stratum.core.pipeline.FileAnalysisException;
import com.stratum.core.tree.SourceFile;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: stratum convert AST SOURCE [AST SOURCE...] [--out DIR]
 */
@Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Transform the given files and reassemble the converted code")
@Component
public class ConvertCommand implements Callable<Integer> {

    @Mixin
    SourceOptions sources;

    @Option(names = {"--out", "-o"}, description = "Directory for converted files (default: print to stdout)")
    Path outDir;

    private final ConversionPipeline pipeline;
    private final EventBus eventBus;

    public ConvertCommand(ConversionPipeline pipeline, EventBus eventBus) {
        this.pipeline = pipeline;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        int failures = 0;
        try {
            for (SourceFile file : sources.sourceFiles()) {
                try {
                    ConversionResult result = pipeline.convert(file, sources.classifier());
                    write(file, result);
                    if (result.unmatchedPlaceholders().isEmpty()) {
                        ConsoleOutput.success(file.fileId() + ": " + result.unitCount() + " unit(s) converted");
                    } else {
                        ConsoleOutput.warn(file.fileId() + ": unmatched placeholders at lines "
                                + result.unmatchedPlaceholders());
                    }
                } catch (FileAnalysisException e) {
                    failures++;
                    ConsoleOutput.error(e.getMessage());
                }
            }
        } catch (IOException | RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } finally {
            subscription.unsubscribe();
        }
        return failures == 0 ? 0 : 1;
    }

    private void write(SourceFile file, ConversionResult result) throws IOException {
        if (outDir == null) {
            System.out.println(result.text());
            return;
        }
        Files.createDirectories(outDir);
        Files.writeString(outDir.resolve(file.fileName()), result.text());
    }
}
