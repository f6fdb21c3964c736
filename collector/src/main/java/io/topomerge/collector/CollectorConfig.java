// file: collector/src/main/java/io/topomerge/collector/CollectorConfig.java
package io.topomerge.collector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a merge run, parsed from CLI args.
 *
 * Supports:
 *  - reports:  report files to merge, in merge order (at least one)
 *  - out:      optional output file; null writes to stdout
 *  - validate: check the merged topology before writing it
 *  - pretty:   pretty-print the merged JSON
 *  - verbose:  log at FINE and print stack traces on failure
 */
public record CollectorConfig(
        List<Path> reports,
        Path out,
        boolean validate,
        boolean pretty,
        boolean verbose,
        boolean help
) {

    public CollectorConfig {
        reports = List.copyOf(reports);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --out,      -o   <path>
     *   --validate, -v
     *   --pretty
     *   --verbose
     *   --help,     -h
     *   --               end of options
     *
     * Everything else is a report file.
     *
     * @throws IllegalArgumentException on unknown options, missing values or no report files
     */
    public static CollectorConfig fromArgs(String[] args) {
        List<Path> reports = new ArrayList<>();
        Path out = null;
        boolean validate = false;
        boolean pretty = false;
        boolean verbose = false;
        boolean optionsDone = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (optionsDone || !arg.startsWith("-")) {
                reports.add(Path.of(arg));
                continue;
            }
            switch (arg) {
                case "--help", "-h" -> {
                    return new CollectorConfig(List.of(), null, false, false, false, true);
                }
                case "--out", "-o" -> {
                    ensureValue(args, i);
                    out = Path.of(args[++i]);
                }
                case "--validate", "-v" -> validate = true;
                case "--pretty" -> pretty = true;
                case "--verbose" -> verbose = true;
                case "--" -> optionsDone = true;
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (reports.isEmpty()) {
            throw new IllegalArgumentException("At least one report file is required");
        }
        return new CollectorConfig(reports, out, validate, pretty, verbose, false);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    static String usage() {
        return """
            Usage: topomerge [options] <report.json>...

            Merges topology reports left to right and prints the result as JSON.

            Options:
              --out,      -o   Write the merged report to a file instead of stdout
              --validate, -v   Fail (exit 3) if the merged topology is inconsistent
              --pretty         Pretty-print the merged JSON
              --verbose        Log every merge and print stack traces
              --help,     -h   Show this help message
            """;
    }
}
