package net.kairo.app.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.kairo.core.model.Job;

import java.time.Instant;

public record JobResponse(
        long id,
        String name,
        String description,
        String schedule,
        @JsonProperty("isActive") boolean active,
        Instant lastRun,
        Instant nextRun,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobResponse from(Job j) {
        return new JobResponse(j.id(), j.name(), j.description(), j.schedule(), j.active(),
                j.lastRun(), j.nextRun(), j.createdAt(), j.updatedAt());
    }
}
