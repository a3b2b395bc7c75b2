package com.labframe.notifications.service.realtime;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide set of change detectors, one per project.
 *
 * A project is registered the first time it is accessed and stays registered
 * until shutdown.
 */
@Slf4j
@Component
public class ChangeDetectorRegistry {

    private final ConcurrentMap<String, ChangeDetector> detectors = new ConcurrentHashMap<>();
    private final ChangeMarkerSource source;
    private final TransactionOperations transactions;

    @Autowired
    public ChangeDetectorRegistry(ChangeMarkerSource source, PlatformTransactionManager transactionManager) {
        this(source, readOnly(transactionManager));
    }

    public ChangeDetectorRegistry(ChangeMarkerSource source, TransactionOperations transactions) {
        this.source = source;
        this.transactions = transactions;
    }

    private static TransactionOperations readOnly(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setReadOnly(true);
        return template;
    }

    /**
     * Returns the project's detector, creating and priming it on first access.
     * Priming failures are logged; the poller primes the detector on its next tick instead.
     */
    public ChangeDetector ensureRegistered(String project) {
        ChangeDetector existing = detectors.get(project);
        if (existing != null) {
            return existing;
        }

        ChangeDetector created = new ChangeDetector(project, source, transactions);
        ChangeDetector raced = detectors.putIfAbsent(project, created);
        if (raced != null) {
            return raced;
        }

        log.info("Registered change detector for project '{}'", project);
        try {
            created.prime();
        } catch (ChangeDetectionException ex) {
            log.warn("Could not prime change detector for project '{}': {}", project, ex.getMessage());
        }
        return created;
    }

    public Optional<ChangeDetector> find(String project) {
        return Optional.ofNullable(detectors.get(project));
    }

    /**
     * @return A snapshot of the registered detectors, safe to iterate while projects register.
     */
    public List<ChangeDetector> detectors() {
        return List.copyOf(detectors.values());
    }

    public Set<String> projects() {
        return new TreeSet<>(detectors.keySet());
    }

    @PreDestroy
    public void clear() {
        if (!detectors.isEmpty()) {
            log.info("Dropping {} change detectors", detectors.size());
        }
        detectors.clear();
    }
}
