package net.kairo.core.model;

public record RunOutcome(Status status, String message, Throwable cause) {

    public enum Status { SUCCESS, FAILED }

    public static RunOutcome success() {
        return new RunOutcome(Status.SUCCESS, null, null);
    }

    public static RunOutcome success(String message) {
        return new RunOutcome(Status.SUCCESS, message, null);
    }

    public static RunOutcome failure(String message) {
        return new RunOutcome(Status.FAILED, message, null);
    }

    public static RunOutcome failure(String message, Throwable cause) {
        return new RunOutcome(Status.FAILED, message, cause);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
