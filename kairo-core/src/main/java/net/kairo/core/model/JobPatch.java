package net.kairo.core.model;

import java.time.Instant;

/**
 * Partial update of a job record. {@code null} fields are left untouched.
 * {@code nextRun} is only set by the admin layer when a schedule change forces a recompute.
 */
public record JobPatch(
        String name,
        String description,
        String schedule,
        Boolean active,
        Instant nextRun
) {
    public static JobPatch empty() {
        return new JobPatch(null, null, null, null, null);
    }

    public JobPatch withNextRun(Instant nextRun) {
        return new JobPatch(name, description, schedule, active, nextRun);
    }

    public boolean isEmpty() {
        return name == null && description == null && schedule == null && active == null && nextRun == null;
    }
}
