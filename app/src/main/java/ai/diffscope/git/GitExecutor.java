package ai.diffscope.git;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs git commands in a repository directory and returns their standard output.
 *
 * <p>Implementations must fail with a {@link GitCommandException} subtype rather than return partial output.
 */
@FunctionalInterface
public interface GitExecutor {
    byte[] run(Path workDir, List<String> args) throws GitCommandException, InterruptedException;

    default String runText(Path workDir, String... args) throws GitCommandException, InterruptedException {
        return new String(run(workDir, List.of(args)), StandardCharsets.UTF_8);
    }

    default String runText(Path workDir, List<String> args) throws GitCommandException, InterruptedException {
        return new String(run(workDir, args), StandardCharsets.UTF_8);
    }
}
