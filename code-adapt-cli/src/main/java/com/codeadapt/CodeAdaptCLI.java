package com.codeadapt;

import ch.qos.logback.classic.Level;
import com.codeadapt.cli.AdaptCommand;
import com.codeadapt.cli.AnalyzeCommand;
import com.codeadapt.cli.CatalogCommand;
import com.codeadapt.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for CodeAdapt.
 *
 * <p>CodeAdapt rewrites JavaScript component snippets to match a project's naming, import,
 * error handling and formatting conventions.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code adapt} - Adapt a component to a target project</li>
 *   <li>{@code analyze} - Show the detected conventions of a source file</li>
 *   <li>{@code catalog} - Discover the customization metadata of a component</li>
 *   <li>{@code validate} - Check a plan against a component</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Adapt a component to a project using snake_case and double quotes
 * codeadapt adapt auth-client.js --target target.json -o src/lib
 *
 * # Show detected conventions
 * codeadapt analyze auth-client.js
 * }</pre>
 */
@Command(
    name = "codeadapt",
    mixinStandardHelpOptions = true,
    version = "CodeAdapt 1.0.0-SNAPSHOT",
    description = "Adapts JavaScript components to the conventions of a target project",
    subcommands = {
        AdaptCommand.class,
        AnalyzeCommand.class,
        CatalogCommand.class,
        ValidateCommand.class
    }
)
public class CodeAdaptCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeAdaptCLI.class);

    private boolean verbose;
    private boolean quiet;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        configureLogging();
    }

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    void setQuiet(boolean quiet) {
        this.quiet = quiet;
        configureLogging();
    }

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("CodeAdapt - Component adaptation engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codeadapt --help' to see available commands");
        System.out.println("Use 'codeadapt <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options. Options are applied while the
     * command line is parsed, so the level is in place before any subcommand runs.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodeAdaptCLI()).execute(args);
        System.exit(exitCode);
    }
}
