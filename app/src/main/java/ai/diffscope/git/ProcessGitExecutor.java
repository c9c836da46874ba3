package ai.diffscope.git;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** {@link GitExecutor} that shells out to the {@code git} binary on the PATH. */
public class ProcessGitExecutor implements GitExecutor {
    private static final Logger logger = LogManager.getLogger(ProcessGitExecutor.class);

    /** Timeout for the local, non-network git commands this tool issues. */
    public static final Duration GIT_TIMEOUT = Duration.ofSeconds(10);

    public static final long DEFAULT_MAX_OUTPUT_BYTES = 10L * 1024 * 1024;

    private static final String MAX_OUTPUT_PROPERTY = "diffscope.git.maxOutputBytes";

    private final Duration timeout;
    private final long maxOutputBytes;

    public ProcessGitExecutor() {
        this(GIT_TIMEOUT, Long.getLong(MAX_OUTPUT_PROPERTY, DEFAULT_MAX_OUTPUT_BYTES));
    }

    public ProcessGitExecutor(Duration timeout, long maxOutputBytes) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("Output ceiling must be positive: " + maxOutputBytes);
        }
        this.timeout = timeout;
        this.maxOutputBytes = maxOutputBytes;
    }

    public long getMaxOutputBytes() {
        return maxOutputBytes;
    }

    @Override
    public byte[] run(Path workDir, List<String> args) throws GitCommandException, InterruptedException {
        var command = new ArrayList<String>(args.size() + 1);
        command.add("git");
        command.addAll(args);
        String display = String.join(" ", command);
        logger.debug("Running `{}` in `{}`", display, workDir);

        ProcessBuilder pb = createProcessBuilder(workDir, command);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new GitCommandException.StartupException(
                    "unable to start git in %s for `%s` (%s)".formatted(workDir, display, e.getMessage()), "");
        }

        CompletableFuture<StreamResult> stdoutFuture =
                CompletableFuture.supplyAsync(() -> readBounded(process.getInputStream(), maxOutputBytes, process));
        CompletableFuture<StreamResult> stderrFuture =
                CompletableFuture.supplyAsync(() -> readBounded(process.getErrorStream(), maxOutputBytes, process));

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new GitCommandException.TimeoutException(
                        "`%s` did not complete within %s".formatted(display, timeout),
                        collect(stderrFuture, display).text());
            }
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            stdoutFuture.cancel(true);
            stderrFuture.cancel(true);
            logger.warn("git command `{}` interrupted", display);
            throw ie;
        }

        StreamResult stdout = collect(stdoutFuture, display);
        StreamResult stderr = collect(stderrFuture, display);
        if (stdout.truncated()) {
            throw new GitCommandException.OutputTooLargeException(
                    "`%s` produced more than %d bytes of output".formatted(display, maxOutputBytes), maxOutputBytes);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new GitCommandException.FailureException(
                    "`%s` failed with exit code %d: %s".formatted(display, exitCode, stderr.text().strip()),
                    stderr.text(),
                    exitCode);
        }
        return stdout.bytes();
    }

    private static ProcessBuilder createProcessBuilder(Path workDir, List<String> command) {
        var pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        // git must never wait on a terminal
        pb.redirectInput(ProcessBuilder.Redirect.from(new File(isWindows() ? "NUL" : "/dev/null")));
        pb.environment().remove("EDITOR");
        pb.environment().remove("VISUAL");
        pb.environment().put("TERM", "dumb");
        pb.environment().put("GIT_PAGER", "cat");
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");
        return pb;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    private record StreamResult(byte[] bytes, boolean truncated) {
        String text() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static StreamResult readBounded(InputStream in, long limit, Process process) {
        var out = new ByteArrayOutputStream();
        var buffer = new byte[8192];
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                if (out.size() + (long) n > limit) {
                    process.destroyForcibly();
                    return new StreamResult(out.toByteArray(), true);
                }
                out.write(buffer, 0, n);
            }
        } catch (IOException e) {
            logger.debug("Error reading git output stream", e);
        }
        return new StreamResult(out.toByteArray(), false);
    }

    private static StreamResult collect(CompletableFuture<StreamResult> future, String display) {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new StreamResult(new byte[0], false);
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Timeout or error collecting output of `{}`: {}", display, e.getMessage());
            future.cancel(true);
            return new StreamResult(new byte[0], false);
        }
    }
}
