package net.kairo.core.executor;

import java.util.Locale;
import java.util.Optional;

public final class JobClassifier {

    // first type whose keyword occurs in the name, ignoring case
    public Optional<JobType> classify(String jobName) {
        if (jobName == null || jobName.isBlank()) return Optional.empty();
        String lower = jobName.toLowerCase(Locale.ROOT);
        for (JobType type : JobType.values()) {
            for (String keyword : type.keywords()) {
                if (lower.contains(keyword)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }
}
