package com.svarx.runtime;

/**
 * Outcome of one OS utility call. {@code output} holds stdout and stderr interleaved, capped to a
 * log-friendly length.
 */
public record CommandResult(
        String program,
        Outcome outcome,
        int exitCode,
        String output) {

    public enum Outcome {
        EXITED,
        TIMED_OUT,
        INTERRUPTED,
        LAUNCH_FAILED
    }

    static CommandResult exited(String program, int exitCode, String output) {
        return new CommandResult(program, Outcome.EXITED, exitCode, output);
    }

    static CommandResult notExited(String program, Outcome outcome, String output) {
        return new CommandResult(program, outcome, -1, output);
    }

    public boolean isSuccess() {
        return outcome == Outcome.EXITED && exitCode == 0;
    }

    public String describe() {
        switch (outcome) {
            case LAUNCH_FAILED:
                return program + " could not be started: " + output;
            case TIMED_OUT:
                return program + " timed out";
            case INTERRUPTED:
                return program + " interrupted";
            default:
                return program + " exit=" + exitCode + (output.isBlank() ? "" : " output=" + output);
        }
    }
}
