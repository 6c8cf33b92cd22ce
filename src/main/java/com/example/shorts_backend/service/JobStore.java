package com.example.shorts_backend.service;

import com.example.shorts_backend.model.Job;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory registry of jobs. Records are immutable {@link Job} snapshots, replaced atomically per
 * key, so a reader always sees either the old or the new snapshot.
 *
 * <p>Lifecycle: inserted {@code QUEUED} on submit, updated only by the job's worker, removed by
 * delete or by the retention sweep.
 */
@Component
public class JobStore {

    private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();
    private final Set<UUID> cancelRequested = ConcurrentHashMap.newKeySet();

    public void insert(Job job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Job already exists: " + job.id());
        }
    }

    public Optional<Job> get(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Applies {@code change} atomically. Returns the new snapshot, or empty when the job no longer
     * exists.
     */
    public Optional<Job> update(UUID id, UnaryOperator<Job> change) {
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    public Optional<Job> remove(UUID id) {
        cancelRequested.remove(id);
        return Optional.ofNullable(jobs.remove(id));
    }

    /**
     * Flags an active job for cancellation. The flag is set under the same per-key atomicity as
     * {@link #update}, so a job cannot finish halfway through the request. Returns false when the
     * job is unknown or already terminal.
     */
    public boolean requestCancel(UUID id) {
        boolean[] flagged = new boolean[1];
        jobs.computeIfPresent(id, (key, current) -> {
            if (!current.isTerminal()) {
                cancelRequested.add(key);
                flagged[0] = true;
            }
            return current;
        });
        return flagged[0];
    }

    public boolean isCancelRequested(UUID id) {
        return cancelRequested.contains(id);
    }

    public List<Job> snapshot() {
        return List.copyOf(jobs.values());
    }

    public int size() {
        return jobs.size();
    }
}
