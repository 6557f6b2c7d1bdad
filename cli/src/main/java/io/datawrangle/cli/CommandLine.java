package io.datawrangle.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed arguments of {@code datawrangle run <recipe.yaml> [--functions <jar>]... [--var
 * name=value]... [--config run.yaml] [--schema-out schema.json]}.
 *
 * @param recipe     the recipe file
 * @param functions  custom function libraries, in addition to the configured ones
 * @param variables  template variables; they win over configured ones
 * @param config     explicit run configuration file, or {@code null}
 * @param schemaOut  file to write the recipe JSON Schema to, or {@code null}
 */
public record CommandLine(
        Path recipe, List<Path> functions, Map<String, String> variables, Path config, Path schemaOut) {

    static final String USAGE = "usage: datawrangle run <recipe.yaml> [--functions <jar>]... "
            + "[--var name=value]... [--config run.yaml] [--schema-out schema.json]";

    public CommandLine {
        functions = List.copyOf(functions);
        variables = Map.copyOf(variables);
    }

    /**
     * @throws UsageException if the arguments do not follow {@link #USAGE}
     */
    public static CommandLine parse(String[] args) {
        if (args.length == 0 || !"run".equals(args[0])) {
            throw new UsageException(args.length == 0 ? "missing command" : "unknown command '" + args[0] + "'");
        }
        Path recipe = null;
        List<Path> functions = new ArrayList<>();
        Map<String, String> variables = new LinkedHashMap<>();
        Path config = null;
        Path schemaOut = null;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--functions":
                    functions.add(Path.of(value(args, ++i, arg)));
                    break;
                case "--var":
                    String assignment = value(args, ++i, arg);
                    int eq = assignment.indexOf('=');
                    if (eq <= 0) {
                        throw new UsageException("--var expects name=value, got '" + assignment + "'");
                    }
                    variables.put(assignment.substring(0, eq), assignment.substring(eq + 1));
                    break;
                case "--config":
                    config = Path.of(value(args, ++i, arg));
                    break;
                case "--schema-out":
                    schemaOut = Path.of(value(args, ++i, arg));
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new UsageException("unknown option '" + arg + "'");
                    }
                    if (recipe != null) {
                        throw new UsageException("only one recipe may be given");
                    }
                    recipe = Path.of(arg);
            }
        }
        if (recipe == null) {
            throw new UsageException("missing recipe file");
        }
        return new CommandLine(recipe, functions, variables, config, schemaOut);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new UsageException(option + " requires a value");
        }
        return args[i];
    }
}
