package net.kairo.core.model;

import java.time.Instant;

public final class TickReport {
    public Instant startedAt;
    public boolean aborted;
    public int fetched;
    public int due;
    public int skippedInFlight;
    public int skippedInvalid;
    public int skippedUnclaimed;
    public int dispatched;
    public int succeeded;
    public int failed;
    public int pending;

    @Override public String toString() {
        return "TickReport{" +
                "startedAt=" + startedAt +
                ", aborted=" + aborted +
                ", fetched=" + fetched +
                ", due=" + due +
                ", skippedInFlight=" + skippedInFlight +
                ", skippedInvalid=" + skippedInvalid +
                ", skippedUnclaimed=" + skippedUnclaimed +
                ", dispatched=" + dispatched +
                ", succeeded=" + succeeded +
                ", failed=" + failed +
                ", pending=" + pending +
                '}';
    }
}
