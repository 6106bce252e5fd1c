package net.kairo.bootstrap.props;

import net.kairo.core.executor.JobType;
import net.kairo.core.executor.UnknownTypePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("kairo")
public class KairoProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Executors executors = new Executors();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Executors getExecutors() {
        return executors;
    }

    public void setExecutors(Executors executors) {
        this.executors = executors;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        /** Start the tick loop with the application context. */
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofMinutes(1);
        private Duration initialDelay = Duration.ZERO;
        private Duration executionTimeout = Duration.ofMinutes(5);
        private Duration gracePeriod = Duration.ofSeconds(30);
        private int maxConcurrentDispatches = 8;
        /** Lease job rows before dispatching; needed when several instances share a database. */
        private boolean claimEnabled = true;
        /** Lease owner token; defaults to a per-process value. */
        private String owner;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getExecutionTimeout() {
            return executionTimeout;
        }

        public void setExecutionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
        }

        public Duration getGracePeriod() {
            return gracePeriod;
        }

        public void setGracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
        }

        public int getMaxConcurrentDispatches() {
            return maxConcurrentDispatches;
        }

        public void setMaxConcurrentDispatches(int maxConcurrentDispatches) {
            this.maxConcurrentDispatches = maxConcurrentDispatches;
        }

        public boolean isClaimEnabled() {
            return claimEnabled;
        }

        public void setClaimEnabled(boolean claimEnabled) {
            this.claimEnabled = claimEnabled;
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Executors {
        private UnknownTypePolicy unknownTypePolicy = UnknownTypePolicy.FAIL;
        private Duration defaultLatency = Duration.ofSeconds(2);
        private Map<JobType, Duration> latency = new EnumMap<>(JobType.class);

        public UnknownTypePolicy getUnknownTypePolicy() {
            return unknownTypePolicy;
        }

        public void setUnknownTypePolicy(UnknownTypePolicy unknownTypePolicy) {
            this.unknownTypePolicy = unknownTypePolicy;
        }

        public Duration getDefaultLatency() {
            return defaultLatency;
        }

        public void setDefaultLatency(Duration defaultLatency) {
            this.defaultLatency = defaultLatency;
        }

        public Map<JobType, Duration> getLatency() {
            return latency;
        }

        public void setLatency(Map<JobType, Duration> latency) {
            this.latency = latency;
        }

        public Duration latencyOf(JobType type) {
            return latency.getOrDefault(type, defaultLatency);
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String description;
        private String schedule;
        private boolean active = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", schedule='" + schedule + '\'' +
                    ", active=" + active +
                    '}';
        }
    }
}
