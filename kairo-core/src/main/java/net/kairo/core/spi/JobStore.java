package net.kairo.core.spi;

import net.kairo.core.model.Job;
import net.kairo.core.model.JobDraft;
import net.kairo.core.model.JobPatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent job records. Implementations may require an enclosing {@link TxRunner} call.
 */
public interface JobStore {
    List<Job> listActive() throws Exception;

    List<Job> findAll() throws Exception;

    Optional<Job> get(long id) throws Exception;

    Optional<Job> findByName(String name) throws Exception;

    /** Writes LAST_RUN / NEXT_RUN, stamps UPDATED_AT with now and clears the lease. Empty if the job was deleted. */
    Optional<Job> updateRunTimestamps(long id, Instant lastRun, Instant nextRun, Instant now) throws Exception;

    Job create(JobDraft draft, Instant now) throws Exception;

    Optional<Job> update(long id, JobPatch patch, Instant now) throws Exception;

    boolean delete(long id) throws Exception;

    /**
     * Conditional lease on the job row. The row must still be active and due at {@code now},
     * and either unleased, expired at {@code now}, or already held by {@code owner}.
     */
    default boolean tryClaim(long id, String owner, Instant now, Instant until) throws Exception {
        return true;
    }

    default void release(long id, String owner) throws Exception {
    }
}
