package ai.diffscope.git;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted {@link GitExecutor} for tests. Responses are keyed by the space-joined argument list; unscripted commands
 * fail with exit code 128 like an unknown revision would.
 */
public class FakeGitExecutor implements GitExecutor {
    private final Map<String, byte[]> outputs = new HashMap<>();
    private final Map<String, GitCommandException> failures = new HashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public FakeGitExecutor respond(String command, String output) {
        outputs.put(command, output.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public FakeGitExecutor fail(String command, GitCommandException failure) {
        failures.put(command, failure);
        return this;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callCount(String prefix) {
        return calls().stream().filter(call -> call.startsWith(prefix)).count();
    }

    @Override
    public byte[] run(Path workDir, List<String> args) throws GitCommandException {
        String command = String.join(" ", args);
        calls.add(command);
        var failure = failures.get(command);
        if (failure != null) {
            throw failure;
        }
        var output = outputs.get(command);
        if (output == null) {
            throw new GitCommandException.FailureException(
                    "unscripted git command: " + command, "fatal: bad revision", 128);
        }
        return output;
    }
}
