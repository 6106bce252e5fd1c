package net.kairo.core.executor;

import java.time.Duration;

public final class GenericJobExecutor extends SimulatedWorkExecutor {
    public GenericJobExecutor(Duration latency) {
        super(latency);
    }

    @Override
    protected String startVerb() {
        return "running";
    }

    @Override
    protected String doneVerb() {
        return "finished";
    }
}
