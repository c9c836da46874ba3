package ai.diffscope.git;

import java.io.IOException;

/**
 * Base class for failures of a {@code git} subprocess. Every subtype carries whatever output was captured before the
 * failure so callers can surface it.
 */
public abstract class GitCommandException extends IOException {
    private final String output;

    protected GitCommandException(String message, String output) {
        super(message);
        this.output = output;
    }

    public String getOutput() {
        return output;
    }

    /** The {@code git} executable could not be started at all. */
    public static class StartupException extends GitCommandException {
        public StartupException(String message, String output) {
            super(message, output);
        }
    }

    /** The command did not complete within its timeout and was killed. */
    public static class TimeoutException extends GitCommandException {
        public TimeoutException(String message, String output) {
            super(message, output);
        }
    }

    /** The command exited with a non-zero exit code. */
    public static class FailureException extends GitCommandException {
        private final int exitCode;

        public FailureException(String message, String output, int exitCode) {
            super(message, output);
            this.exitCode = exitCode;
        }

        public int getExitCode() {
            return exitCode;
        }
    }

    /** The command produced more output than the configured ceiling; it was killed and its output discarded. */
    public static class OutputTooLargeException extends GitCommandException {
        private final long limitBytes;

        public OutputTooLargeException(String message, long limitBytes) {
            super(message, "");
            this.limitBytes = limitBytes;
        }

        public long getLimitBytes() {
            return limitBytes;
        }
    }
}
