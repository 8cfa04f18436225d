package com.codeadapt.cli;

import com.codeadapt.core.adapter.ComponentFiles;
import com.codeadapt.core.analysis.PatternAnalysis;
import com.codeadapt.core.analysis.PatternAnalyzer;
import com.codeadapt.core.model.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to show the conventions detected in a component.
 */
@Command(
    name = "analyze",
    description = "Show the naming, import and error handling conventions of a component",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Component file (.json component or plain source)")
    private Path componentFile;

    @Option(names = {"--json"}, description = "Print the analysis as JSON")
    private boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Component component = ComponentFiles.readComponent(componentFile);
            PatternAnalysis analysis = new PatternAnalyzer().analyze(component.source());
            log.debug("Analyzed {}", componentFile);
            if (json) {
                out.println(ComponentFiles.toJson(analysis));
            } else {
                out.println("Naming:         " + analysis.naming().id());
                out.println("Imports:        " + analysis.importStyle().id());
                out.println("Error handling: " + analysis.errorHandling().id());
            }
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            spec.commandLine().getErr().println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }
}
