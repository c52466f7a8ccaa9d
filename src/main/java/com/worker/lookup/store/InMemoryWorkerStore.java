package com.worker.lookup.store;

import com.worker.lookup.core.model.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link RecordStore} for workers.
 * Suitable for testing and for running the lookup without a database.
 *
 * <p>Matches case-insensitively on first name, last name, email and full name.
 * Rows are ordered like the SQL lookup: full-name prefix first, then first-name
 * prefix, then last-name prefix, then everything else, each group by name.</p>
 */
public class InMemoryWorkerStore implements RecordStore<Worker> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkerStore.class);

    private final ConcurrentMap<Long, Worker> workers = new ConcurrentHashMap<>();

    public InMemoryWorkerStore() {
    }

    public InMemoryWorkerStore(Collection<Worker> initial) {
        initial.forEach(this::save);
    }

    public Worker save(Worker worker) {
        workers.put(worker.id(), worker);
        log.debug("Saved worker {} ({})", worker.id(), worker.fullName());
        return worker;
    }

    public Optional<Worker> findById(long id) {
        return Optional.ofNullable(workers.get(id));
    }

    public boolean delete(long id) {
        return workers.remove(id) != null;
    }

    public int count() {
        return workers.size();
    }

    @Override
    public List<Worker> search(String term, int limit) {
        if (term == null || term.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = term.toLowerCase(Locale.ROOT);
        return workers.values().stream()
                .filter(w -> contains(w.firstName(), needle)
                        || contains(w.lastName(), needle)
                        || contains(w.email(), needle)
                        || contains(w.fullName(), needle))
                .sorted(Comparator.comparingInt((Worker w) -> priority(w, needle))
                        .thenComparing(w -> lower(w.firstName()))
                        .thenComparing(w -> lower(w.lastName())))
                .limit(limit)
                .toList();
    }

    @Override
    public String getName() {
        return "workers";
    }

    private static int priority(Worker w, String needle) {
        if (lower(w.fullName()).startsWith(needle)) {
            return 1;
        }
        if (lower(w.firstName()).startsWith(needle)) {
            return 2;
        }
        if (lower(w.lastName()).startsWith(needle)) {
            return 3;
        }
        return 4;
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
