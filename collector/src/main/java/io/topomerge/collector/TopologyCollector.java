// file: src/main/java/io/topomerge/collector/TopologyCollector.java
package io.topomerge.collector;

import io.topomerge.core.DelimitedIdCodec;
import io.topomerge.core.IdCodec;
import io.topomerge.core.Topology;
import io.topomerge.core.TopologyValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates probe reports into one current topology.
 * <p>
 * Topologies are immutable, so the only shared state is the reference to
 * the current value. Writers merge into a snapshot of it and publish the
 * result with compare-and-set, retrying when another writer got there first.
 * Readers just take the reference; they never block.
 * <p>
 * Each merge copies the whole topology, so callers with many small reports
 * should prefer {@link #addAll} (fold the batch, then swap once).
 */
public final class TopologyCollector {
    private static final Logger log = Logger.getLogger(TopologyCollector.class.getName());

    private final AtomicReference<Topology> current = new AtomicReference<>(Topology.empty());
    private final AtomicLong reports = new AtomicLong();
    private final AtomicLong swaps = new AtomicLong();
    private final IdCodec codec;

    public TopologyCollector() {
        this(DelimitedIdCodec.standard());
    }

    /**
     * @param codec identifier codec used by {@link #validateCurrent()}
     */
    public TopologyCollector(IdCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /** Merge a single report into the current topology and return the new value. */
    public Topology add(Topology report) {
        Objects.requireNonNull(report, "report");
        Topology merged = swapIn(report);
        reports.incrementAndGet();
        if (log.isLoggable(Level.FINE)) {
            log.fine(String.format("merged report (%d nodes, %d edges) -> %d nodes, %d edges",
                    report.nodeMetadatas().size(), report.edgeMetadatas().size(),
                    merged.nodeMetadatas().size(), merged.edgeMetadatas().size()));
        }
        return merged;
    }

    /**
     * Fold a batch of reports left to right and merge the result with a single swap.
     * An empty batch leaves the current topology untouched.
     */
    public Topology addAll(Collection<Topology> batch) {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) return current.get();

        // Snapshot the batch so concurrent modification of the caller's collection can't tear it.
        var snapshot = new ArrayList<Topology>(batch.size());
        for (Topology t : batch) {
            snapshot.add(Objects.requireNonNull(t, "report"));
        }
        Topology merged = swapIn(Topology.mergeAll(snapshot));
        reports.addAndGet(snapshot.size());
        log.info(String.format("merged batch of %d report(s) -> %d nodes, %d edges",
                snapshot.size(), merged.nodeMetadatas().size(), merged.edgeMetadatas().size()));
        return merged;
    }

    /** Latest merged topology. */
    public Topology current() {
        return current.get();
    }

    /** Swap back to an empty topology and return what had been collected. */
    public Topology reset() {
        Topology previous = current.getAndSet(Topology.empty());
        swaps.incrementAndGet();
        log.info(String.format("reset collector (dropped %d nodes, %d edges)",
                previous.nodeMetadatas().size(), previous.edgeMetadatas().size()));
        return previous;
    }

    /**
     * Validate the latest merged topology.
     *
     * @throws TopologyValidationException with every violation found
     */
    public Topology validateCurrent() throws TopologyValidationException {
        Topology snapshot = current.get();
        try {
            snapshot.validate(codec);
        } catch (TopologyValidationException e) {
            log.log(Level.WARNING, "collected topology is inconsistent: " + e.getMessage());
            throw e;
        }
        return snapshot;
    }

    /** Number of reports merged so far (batch members count individually). */
    public long reportCount() {
        return reports.get();
    }

    /** Number of successful reference swaps. */
    public long swapCount() {
        return swaps.get();
    }

    private Topology swapIn(Topology report) {
        while (true) {
            Topology base = current.get();
            Topology merged = base.merge(report);
            if (current.compareAndSet(base, merged)) {
                swaps.incrementAndGet();
                return merged;
            }
            // Lost the race: someone else published first. Merge again on top of theirs.
        }
    }
}
