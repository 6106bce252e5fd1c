package net.kairo.core.store;

import net.kairo.core.model.Job;
import net.kairo.core.model.JobDraft;
import net.kairo.core.model.JobPatch;
import net.kairo.core.spi.JobStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Heap-backed {@link JobStore}. Every operation is atomic; no {@code TxRunner} needed.
 */
public class InMemoryJobStore implements JobStore {
    private final Map<Long, Job> rows = new TreeMap<>();
    private long seq;

    @Override
    public synchronized List<Job> listActive() {
        List<Job> out = new ArrayList<>();
        for (Job j : rows.values()) {
            if (j.active()) out.add(j);
        }
        return out;
    }

    @Override
    public synchronized List<Job> findAll() {
        return new ArrayList<>(rows.values());
    }

    @Override
    public synchronized Optional<Job> get(long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized Optional<Job> findByName(String name) {
        return rows.values().stream()
                .filter(j -> j.name().equalsIgnoreCase(name))
                .min(Comparator.comparing(Job::id));
    }

    @Override
    public synchronized Optional<Job> updateRunTimestamps(long id, Instant lastRun, Instant nextRun, Instant now) {
        Job current = rows.get(id);
        if (current == null) return Optional.empty();
        Job updated = current.withRunTimestamps(lastRun, nextRun, now);
        rows.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized Job create(JobDraft draft, Instant now) {
        long id = ++seq;
        Job job = new Job(id, draft.name(), draft.description(), draft.schedule(), draft.activeOrDefault(),
                null, null, null, null, now, now);
        rows.put(id, job);
        return job;
    }

    @Override
    public synchronized Optional<Job> update(long id, JobPatch patch, Instant now) {
        Job c = rows.get(id);
        if (c == null) return Optional.empty();
        Job updated = new Job(
                c.id(),
                patch.name() != null ? patch.name() : c.name(),
                patch.description() != null ? patch.description() : c.description(),
                patch.schedule() != null ? patch.schedule() : c.schedule(),
                patch.active() != null ? patch.active() : c.active(),
                c.lastRun(),
                patch.nextRun() != null ? patch.nextRun() : c.nextRun(),
                c.leaseOwner(),
                c.leaseUntil(),
                c.createdAt(),
                now);
        rows.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized boolean delete(long id) {
        return rows.remove(id) != null;
    }

    @Override
    public synchronized boolean tryClaim(long id, String owner, Instant now, Instant until) {
        Job c = rows.get(id);
        if (c == null || !stillDue(c, now)) return false;
        boolean free = c.leaseUntil() == null || !c.leaseUntil().isAfter(now) || owner.equals(c.leaseOwner());
        if (!free) return false;
        rows.put(id, c.withLease(owner, until));
        return true;
    }

    @Override
    public synchronized void release(long id, String owner) {
        Job c = rows.get(id);
        if (c != null && owner.equals(c.leaseOwner())) {
            rows.put(id, c.withLease(null, null));
        }
    }

    private static boolean stillDue(Job c, Instant now) {
        return c.active() && (!c.hasRun() || (c.nextRun() != null && !c.nextRun().isAfter(now)));
    }

    /** Replaces a row wholesale, bypassing the partial-update rules. */
    public synchronized void put(Job job) {
        rows.put(job.id(), job);
        seq = Math.max(seq, job.id());
    }
}
