package io.datawrangle.cli;

import io.datawrangle.cli.config.ConfigLoadException;
import io.datawrangle.cli.config.ConfigLoader;
import io.datawrangle.cli.config.RunConfig;
import io.datawrangle.core.RecipeEngine;
import io.datawrangle.core.engine.RunOptions;
import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.RunSummary;
import io.datawrangle.core.model.SchemaViolation;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.Credentials;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: {@code datawrangle run <recipe.yaml>}. Prints a run report on stdout
 * and exits with 0 when the run completed, 1 when it failed and 2 on a usage or configuration
 * error.
 */
public final class RecipeMain {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeMain.class);

    static final int EXIT_COMPLETED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final Path workingDirectory;
    private final boolean configureLogging;

    RecipeMain(
            PrintStream out,
            PrintStream err,
            Function<String, String> envLookup,
            Path workingDirectory,
            boolean configureLogging) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
        this.workingDirectory = workingDirectory;
        this.configureLogging = configureLogging;
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, see {@link CommandLine#USAGE}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status = new RecipeMain(System.out, System.err, System::getenv, Path.of(""), true).run(args);
        System.exit(status);
    }

    /** Runs one command line and returns its exit status. */
    int run(String[] args) {
        CommandLine command;
        RunConfig config;
        try {
            command = CommandLine.parse(args);
            config = ConfigLoader.loadOrDefault(command.config(), workingDirectory, envLookup);
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(CommandLine.USAGE);
            return EXIT_USAGE;
        } catch (ConfigLoadException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (configureLogging) {
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        }

        Path baseDirectory = workingDirectory.resolve(config.baseDirectory());
        RecipeEngine engine = RecipeEngine.builder().baseDirectory(baseDirectory).build();
        if (command.schemaOut() != null) {
            try {
                engine.writeSchema(workingDirectory.resolve(command.schemaOut()));
            } catch (UncheckedIOException e) {
                LOG.error("Schema export failed: path={}", command.schemaOut(), e);
                err.println("error: " + e.getMessage());
                return EXIT_FAILED;
            }
        }

        RunOptions options = options(command, config, baseDirectory);
        RunSummary summary = engine.run(workingDirectory.resolve(command.recipe()), options);
        report(summary);
        return summary.isCompleted() ? EXIT_COMPLETED : EXIT_FAILED;
    }

    private RunOptions options(CommandLine command, RunConfig config, Path baseDirectory) {
        RunOptions.Builder options = RunOptions.builder()
                .envLookup(envLookup)
                .variables(config.variables())
                .variables(command.variables());
        config.credentials().forEach((name, values) -> options.credentials(name, Credentials.of(values)));
        config.functionLibraries().forEach(library -> options.functionLibrary(baseDirectory.resolve(library)));
        command.functions().forEach(library -> options.functionLibrary(workingDirectory.resolve(library)));
        config.functions().forEach(options::function);
        return options.build();
    }

    private void report(RunSummary summary) {
        if (summary.isCompleted()) {
            out.printf(
                    "run %s COMPLETED in %d ms: %d rows, %d columns%n",
                    summary.runId(),
                    summary.totalDuration().toMillis(),
                    summary.dataset().rowCount(),
                    summary.dataset().columnCount());
        } else {
            out.printf(
                    "run %s FAILED during %s: %s%n",
                    summary.runId(),
                    summary.failedIn(),
                    summary.failure().getMessage());
        }
        for (SchemaViolation violation : summary.violations()) {
            out.println("  violation " + violation);
        }
        for (ExecutionRecord record : summary.records()) {
            out.printf(
                    "  %-24s %-10s %-9s %5d ms%s%n",
                    record.position(),
                    record.kind(),
                    record.status(),
                    record.duration().toMillis(),
                    describe(record));
        }
        for (WriteAcknowledgement write : summary.writes()) {
            out.printf("  wrote %d rows via %s to %s%n", write.rowsWritten(), write.connector(), write.location());
        }
    }

    private static String describe(ExecutionRecord record) {
        StringBuilder detail = new StringBuilder();
        if (record.skippedRows() > 0) {
            detail.append("  skipped_rows=").append(record.skippedRows());
        }
        if (record.hasError()) {
            detail.append("  ").append(record.error());
        }
        return detail.toString();
    }
}
