package com.codeadapt.cli;

import com.codeadapt.core.adapter.ComponentFiles;
import com.codeadapt.core.catalog.ComponentCataloger;
import com.codeadapt.core.model.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to discover the customization metadata of a component.
 *
 * <p>Prints the metadata as JSON, or writes the cataloged component to a file that
 * {@code adapt} and {@code validate} accept.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeadapt catalog auth-client.js
 * codeadapt catalog auth-client.js -o auth-client.json
 * }</pre>
 */
@Command(
    name = "catalog",
    description = "Discover variables, injection points, patterns and dependencies of a component",
    mixinStandardHelpOptions = true
)
public class CatalogCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CatalogCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Component file (.json component or plain source)")
    private Path componentFile;

    @Option(names = {"-o", "--output"}, description = "Write the cataloged component JSON to this file")
    private Path outputFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Component cataloged = new ComponentCataloger().catalog(ComponentFiles.readComponent(componentFile));
            if (outputFile != null) {
                Files.writeString(outputFile, ComponentFiles.toJson(cataloged));
                out.println("✓ Wrote " + outputFile);
            } else {
                out.println(ComponentFiles.toJson(cataloged.metadata()));
            }
            return 0;
        } catch (Exception e) {
            log.error("Cataloging failed", e);
            spec.commandLine().getErr().println("✗ Cataloging failed: " + e.getMessage());
            return 1;
        }
    }
}
