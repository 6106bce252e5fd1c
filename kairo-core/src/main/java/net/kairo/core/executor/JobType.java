package net.kairo.core.executor;

import java.util.List;

/** Executor variants. Declaration order is the classification order. */
public enum JobType {
    EMAIL(List.of("email")),
    NOTIFICATION(List.of("notification", "notify", "send")),
    REPORT(List.of("report")),
    // fallback only, never produced by classification
    GENERIC(List.of());

    private final List<String> keywords;

    JobType(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }
}
