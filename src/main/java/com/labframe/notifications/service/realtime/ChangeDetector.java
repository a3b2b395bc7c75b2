package com.labframe.notifications.service.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.function.Supplier;

/**
 * Detects recorded changes of one project by comparing the project's current
 * change marker with the highest marker already reported (the high-water mark).
 *
 * The first successful detection only primes the mark and reports nothing, so
 * a freshly registered project does not announce its whole history. Calls are
 * serialised per instance on a private lock; the mark is never shared with
 * another detector.
 */
@Slf4j
public class ChangeDetector {

    private final String project;
    private final ChangeMarkerSource source;
    private final TransactionOperations transactions;

    private final Object lock = new Object();

    // null until primed; guarded by lock
    private Long lastMarker;

    public ChangeDetector(String project, ChangeMarkerSource source, TransactionOperations transactions) {
        this.project = project;
        this.source = source;
        this.transactions = transactions;
    }

    public String getProject() {
        return project;
    }

    /**
     * Reads the project's marker and, if it moved past the high-water mark, the
     * sorted distinct topics touched since. Both reads share one read-only
     * transaction. The mark is only advanced once both reads succeeded.
     *
     * @return {@link DetectionResult#NONE} when nothing changed or on priming.
     * @throws ChangeDetectionException when the datastore could not be read.
     */
    public DetectionResult detectChanges() {
        synchronized (lock) {
            Snapshot snapshot = read(this::readSnapshot);
            if (snapshot == null) {
                return DetectionResult.NONE;
            }

            if (lastMarker == null) {
                lastMarker = snapshot.marker();
                log.debug("Primed change detector for project '{}' at marker {}", project, lastMarker);
                return DetectionResult.NONE;
            }
            if (snapshot.marker() <= lastMarker) {
                return DetectionResult.NONE;
            }

            long previous = lastMarker;
            lastMarker = snapshot.marker();
            log.debug("Project '{}' moved from marker {} to {}: {}", project, previous, lastMarker, snapshot.topics());
            return DetectionResult.changed(snapshot.topics());
        }
    }

    /**
     * Sets the high-water mark to the project's current marker if it is not set yet.
     * Never reports changes and never moves an existing mark.
     *
     * @return true if this call primed the detector.
     * @throws ChangeDetectionException when the datastore could not be read.
     */
    public boolean prime() {
        synchronized (lock) {
            if (lastMarker != null) {
                return false;
            }
            Long current = read(() -> source.currentChangeMarker(project));
            if (current == null) {
                return false;
            }
            lastMarker = current;
            log.debug("Primed change detector for project '{}' at marker {}", project, lastMarker);
            return true;
        }
    }

    private <T> T read(Supplier<T> query) {
        try {
            return transactions.execute(status -> query.get());
        } catch (DataAccessException | TransactionException ex) {
            throw new ChangeDetectionException(project, ex);
        }
    }

    private Snapshot readSnapshot() {
        long current = source.currentChangeMarker(project);
        Long known = lastMarker;
        if (known == null || current <= known) {
            return new Snapshot(current, List.of());
        }
        return new Snapshot(current, source.topicsChangedSince(project, known, current));
    }

    /**
     * Forgets the high-water mark; the next detection primes it again.
     */
    public void reset() {
        synchronized (lock) {
            lastMarker = null;
        }
    }

    /**
     * @return The high-water mark, or null while the detector is not primed.
     */
    public Long getLastMarker() {
        synchronized (lock) {
            return lastMarker;
        }
    }

    private record Snapshot(long marker, List<String> topics) {}
}
