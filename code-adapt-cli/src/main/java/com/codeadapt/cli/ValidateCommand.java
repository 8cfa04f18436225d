package com.codeadapt.cli;

import com.codeadapt.core.adapter.ComponentFiles;
import com.codeadapt.core.catalog.ComponentCataloger;
import com.codeadapt.core.config.ConfigLoader;
import com.codeadapt.core.directive.DirectiveValidator;
import com.codeadapt.core.directive.ValidationResult;
import com.codeadapt.core.model.AdaptationPlan;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.CustomizationMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to check an adaptation plan against a component.
 *
 * <p>Exits with 0 when every directive is valid and 1 when any directive would be dropped.
 */
@Command(
    name = "validate",
    description = "Validate the directives of a plan against a component",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Plan JSON file")
    private Path planFile;

    @Option(names = {"--component"}, required = true, description = "Component file the plan applies to")
    private Path componentFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: codeadapt.yml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            AdaptationPlan plan = ComponentFiles.readPlan(planFile);
            Component component = ComponentFiles.readComponent(componentFile);
            if (component.metadata().equals(CustomizationMetadata.empty())) {
                component = new ComponentCataloger().catalog(component);
            }
            ValidationResult result = new DirectiveValidator(component.metadata(),
                ConfigLoader.load(configPath).naming().extraBuiltinSet()).validate(plan.transformations());

            log.info("Validated plan {} against {}", planFile, componentFile);
            out.println("Valid directives: " + result.directives().size() + "/" + plan.transformations().size());
            for (AdaptationWarning warning : result.warnings()) {
                err.println("✗ " + warning.type() + ": " + warning.message());
            }
            if (result.warnings().isEmpty()) {
                out.println("✓ Plan is valid");
                return 0;
            }
            return 1;
        } catch (Exception e) {
            log.error("Validation failed", e);
            err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
