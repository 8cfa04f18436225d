package com.codeadapt.cli;

import com.codeadapt.core.adapter.ComponentAdapter;
import com.codeadapt.core.adapter.ComponentFiles;
import com.codeadapt.core.config.AdapterConfig;
import com.codeadapt.core.config.ConfigLoader;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.AdaptedResult;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.GeneratedFile;
import com.codeadapt.core.model.TargetContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to adapt a component to a target project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the adapted code
 * codeadapt adapt auth-client.js --target target.json
 *
 * # Set configuration values and write all files to a directory
 * codeadapt adapt auth-client.json -C apiUrl="'https://api.example.com'" -o src/lib
 *
 * # Apply a plan written earlier
 * codeadapt adapt auth-client.js --plan plan.json
 *
 * # Print the full result as JSON
 * codeadapt adapt auth-client.js --json
 * }</pre>
 */
@Command(
    name = "adapt",
    description = "Adapt a component to the conventions of a target project",
    mixinStandardHelpOptions = true
)
public class AdaptCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AdaptCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Component file (.json component or plain source)")
    private Path componentFile;

    @Option(names = {"-t", "--target"}, description = "Target context JSON file")
    private Path targetFile;

    @Option(names = {"-C", "--set"}, description = "Customization value, e.g. -C timeout=5000")
    private Map<String, String> values = new LinkedHashMap<>();

    @Option(names = {"--customizations"}, description = "JSON file with customization values")
    private Path customizationsFile;

    @Option(names = {"-p", "--plan"}, description = "Apply this plan JSON file instead of planning")
    private Path planFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: codeadapt.yml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "Directory to write the adapted files to")
    private Path outputDir;

    @Option(names = {"--json"}, description = "Print the full result as JSON")
    private boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            AdapterConfig config = ConfigLoader.load(configPath);
            Component component = ComponentFiles.readComponent(componentFile);
            TargetContext target = targetFile != null ? ComponentFiles.readTarget(targetFile) : TargetContext.empty();
            Map<String, String> customizations = new LinkedHashMap<>();
            if (customizationsFile != null) {
                customizations.putAll(ComponentFiles.readCustomizations(customizationsFile));
            }
            customizations.putAll(values);

            log.info("Adapting {}", componentFile);
            ComponentAdapter adapter = new ComponentAdapter(config);
            AdaptedResult result = planFile != null
                ? adapter.applyPlan(component, ComponentFiles.readPlan(planFile), target)
                : adapter.adapt(component, target, customizations);

            if (json) {
                out.println(ComponentFiles.toJson(result));
            } else if (outputDir != null) {
                writeFiles(result, out);
            } else {
                out.println(result.files().get(0).content());
            }
            printWarnings(result, err);
            return 0;
        } catch (Exception e) {
            log.error("Adaptation failed", e);
            err.println("✗ Adaptation failed: " + e.getMessage());
            return 1;
        }
    }

    private void writeFiles(AdaptedResult result, PrintWriter out) throws IOException {
        Files.createDirectories(outputDir);
        for (GeneratedFile file : result.files()) {
            Path path = outputDir.resolve(file.relativePath());
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, file.content());
            out.println("✓ Wrote " + path);
        }
        if (!result.instructions().install().isEmpty()) {
            out.println();
            out.println("Install:");
            result.instructions().install().forEach(step -> out.println("  " + step));
        }
        if (!result.instructions().setup().isEmpty()) {
            out.println();
            out.println("Setup:");
            result.instructions().setup().forEach(step -> out.println("  " + step));
        }
        out.println();
        out.println("Usage:");
        out.println(result.instructions().usage());
    }

    private static void printWarnings(AdaptedResult result, PrintWriter err) {
        for (AdaptationWarning warning : result.warnings()) {
            err.println("⚠ " + warning.type() + ": " + warning.message());
        }
    }
}
