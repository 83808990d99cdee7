package com.stratum.dispatch.cli;

import com.stratum.core.events.EventBus;
import com.stratum.core.pipeline.AnalysisEngine;
import com.stratum.core.pipeline.FileOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: stratum analyze AST SOURCE [AST SOURCE...]
 */
@Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Summarize every statement and container of the given files into the graph")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Mixin
    SourceOptions sources;

    private final AnalysisEngine engine;
    private final EventBus eventBus;

    public AnalyzeCommand(AnalysisEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        try {
            List<FileOutcome> outcomes = engine.analyzeAll(sources.sourceFiles(), sources.classifier());
            System.out.println();
            for (FileOutcome outcome : outcomes) {
                if (outcome.succeeded()) {
                    var r = outcome.report();
                    ConsoleOutput.success(String.format("%s: %d batches, %d forfeited, %d containers%s",
                            r.fileId(), r.batchCount(), r.forfeitedNodes(), r.containersSummarized(),
                            r.gaps().isEmpty() ? "" : ", skipped batches " + r.gaps()));
                } else {
                    ConsoleOutput.error(outcome.error());
                }
            }
            return outcomes.stream().allMatch(FileOutcome::succeeded) ? 0 : 1;
        } catch (RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } finally {
            subscription.unsubscribe();
        }
    }
}
