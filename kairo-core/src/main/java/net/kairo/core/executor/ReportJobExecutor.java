package net.kairo.core.executor;

import java.time.Duration;

public final class ReportJobExecutor extends SimulatedWorkExecutor {
    public ReportJobExecutor(Duration latency) {
        super(latency);
    }

    @Override
    protected String startVerb() {
        return "generating report";
    }

    @Override
    protected String doneVerb() {
        return "report generated";
    }
}
