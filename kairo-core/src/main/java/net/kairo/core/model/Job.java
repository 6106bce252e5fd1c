package net.kairo.core.model;

import java.time.Instant;

public record Job(
        Long id,
        String name,
        String description,
        String schedule,
        boolean active,
        Instant lastRun,
        Instant nextRun,
        String leaseOwner,
        Instant leaseUntil,
        Instant createdAt,
        Instant updatedAt
) {
    public boolean hasRun() {
        return lastRun != null;
    }

    public Job withRunTimestamps(Instant lastRun, Instant nextRun, Instant updatedAt) {
        return new Job(id, name, description, schedule, active, lastRun, nextRun,
                null, null, createdAt, updatedAt);
    }

    public Job withLease(String owner, Instant until) {
        return new Job(id, name, description, schedule, active, lastRun, nextRun,
                owner, until, createdAt, updatedAt);
    }
}
