package net.kairo.core.service;

import net.kairo.core.model.Job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides due-ness from the stored {@code nextRun} commitment. The cron expression is not
 * re-evaluated here, so a job fires once per occurrence even if several ticks land in
 * the same matching minute.
 */
public final class DueJobSelector {

    public boolean isDue(Job job, Instant now) {
        if (!job.active()) return false;
        if (!job.hasRun()) return true;
        return job.nextRun() != null && !now.isBefore(job.nextRun());
    }

    public List<Job> selectDue(Collection<Job> jobs, Instant now) {
        List<Job> due = new ArrayList<>();
        for (Job job : jobs) {
            if (isDue(job, now)) due.add(job);
        }
        return due;
    }
}
