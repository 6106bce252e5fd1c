package net.kairo.core.executor;

import net.kairo.core.error.UnknownJobTypeException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class JobExecutorRegistry {
    private final Map<JobType, JobExecutor> executors;
    private final JobClassifier classifier;
    private final UnknownTypePolicy policy;

    public JobExecutorRegistry(Map<JobType, ? extends JobExecutor> executors,
                               JobClassifier classifier,
                               UnknownTypePolicy policy) {
        this.executors = Map.copyOf(Objects.requireNonNull(executors, "executors"));
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (policy == UnknownTypePolicy.DEFAULT && !this.executors.containsKey(JobType.GENERIC)) {
            throw new IllegalArgumentException("UnknownTypePolicy.DEFAULT requires a GENERIC executor");
        }
    }

    public static JobExecutorRegistry of(Map<JobType, ? extends JobExecutor> executors, UnknownTypePolicy policy) {
        return new JobExecutorRegistry(executors, new JobClassifier(), policy);
    }

    public Optional<JobType> typeOf(String jobName) {
        Optional<JobType> classified = classifier.classify(jobName).filter(executors::containsKey);
        if (classified.isPresent()) return classified;
        return policy == UnknownTypePolicy.DEFAULT ? Optional.of(JobType.GENERIC) : Optional.empty();
    }

    /**
     * @throws UnknownJobTypeException when nothing matches and the policy is {@link UnknownTypePolicy#FAIL}
     */
    public JobExecutor resolve(String jobName) {
        JobType type = typeOf(jobName).orElseThrow(() -> new UnknownJobTypeException(jobName));
        return executors.get(type);
    }

    public UnknownTypePolicy policy() {
        return policy;
    }
}
