package net.kairo.core.model;

/** Payload for a new job. {@code active == null} means active. */
public record JobDraft(
        String name,
        String description,
        String schedule,
        Boolean active
) {
    public static JobDraft of(String name, String schedule) {
        return new JobDraft(name, null, schedule, null);
    }

    public boolean activeOrDefault() {
        return active == null || active;
    }
}
