package net.kairo.integration.spring.sched;

import net.kairo.core.service.SchedulerLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link SchedulerLoop} once the context is refreshed and stops it first on close,
 * ahead of the {@code DataSource} it depends on.
 */
public class KairoSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(KairoSchedulerLifecycle.class);

    private final SchedulerLoop loop;
    private final boolean autoStart;

    public KairoSchedulerLifecycle(SchedulerLoop loop, boolean autoStart) {
        this.loop = loop;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        if (!autoStart) log.info("Starting scheduler on demand");
        loop.start();
    }

    @Override
    public void stop() {
        loop.stop();
    }

    @Override
    public boolean isRunning() {
        return loop.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE - 1024;
    }

    public SchedulerLoop loop() {
        return loop;
    }
}
