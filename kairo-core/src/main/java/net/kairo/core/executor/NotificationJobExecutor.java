package net.kairo.core.executor;

import java.time.Duration;

public final class NotificationJobExecutor extends SimulatedWorkExecutor {
    public NotificationJobExecutor(Duration latency) {
        super(latency);
    }

    @Override
    protected String startVerb() {
        return "dispatching notification";
    }

    @Override
    protected String doneVerb() {
        return "notification delivered";
    }
}
