package net.kairo.core.executor;

import java.time.Duration;

public final class EmailJobExecutor extends SimulatedWorkExecutor {
    public EmailJobExecutor(Duration latency) {
        super(latency);
    }

    @Override
    protected String startVerb() {
        return "sending email";
    }

    @Override
    protected String doneVerb() {
        return "email sent";
    }
}
