// file: collector/src/main/java/io/topomerge/collector/MergeCli.java
package io.topomerge.collector;

import io.topomerge.codec.TopologyCodecException;
import io.topomerge.codec.TopologyJson;
import io.topomerge.core.Topology;
import io.topomerge.core.TopologyValidationException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line tool that merges topology report files.
 *
 * Usage:
 *   topomerge [--validate] [--pretty] [--out merged.json] report1.json report2.json ...
 *
 * Exit codes:
 *   0  merged (and valid, when --validate is given)
 *   1  usage error
 *   2  a report could not be read or decoded, or the output could not be written
 *   3  --validate was given and the merged topology is inconsistent
 */
public final class MergeCli {
    private static final Logger log = Logger.getLogger(MergeCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_INVALID = 3;

    private final PrintStream out;
    private final PrintStream err;

    MergeCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new MergeCli(System.out, System.err).run(args));
    }

    int run(String[] args) {
        CollectorConfig cfg;
        try {
            cfg = CollectorConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.print(CollectorConfig.usage());
            return EXIT_USAGE;
        }
        if (cfg.help()) {
            out.print(CollectorConfig.usage());
            return EXIT_OK;
        }
        if (cfg.verbose()) {
            enableVerboseLogging();
        }

        try {
            return merge(cfg);
        } catch (IOException | TopologyCodecException e) {
            err.println("error: " + e.getMessage());
            if (cfg.verbose()) {
                e.printStackTrace(err);
            }
            return EXIT_IO;
        }
    }

    private int merge(CollectorConfig cfg) throws IOException {
        var reports = new ArrayList<Topology>(cfg.reports().size());
        for (Path path : cfg.reports()) {
            Topology report = TopologyJson.read(path);
            log.fine(() -> "read " + path + ": " + report.nodeMetadatas().size() + " nodes, "
                    + report.edgeMetadatas().size() + " edges");
            reports.add(report);
        }

        var collector = new TopologyCollector();
        Topology merged = collector.addAll(reports);

        if (cfg.validate()) {
            try {
                collector.validateCurrent();
            } catch (TopologyValidationException e) {
                err.println("error: merged topology is inconsistent, " + e.violations().size() + " violation(s):");
                for (String v : e.violations()) {
                    err.println("  " + v);
                }
                return EXIT_INVALID;
            }
        }

        byte[] json = TopologyJson.encode(merged, cfg.pretty());
        if (cfg.out() != null) {
            Files.write(cfg.out(), json);
            log.info("wrote merged topology to " + cfg.out());
        } else {
            out.write(json, 0, json.length);
            out.println();
            out.flush();
        }
        return EXIT_OK;
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler h : root.getHandlers()) {
            h.setLevel(Level.FINE);
        }
    }
}
