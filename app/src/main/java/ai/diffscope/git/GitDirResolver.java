package ai.diffscope.git;

import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Locates the git metadata directory of a working tree. In a linked worktree this is a directory outside the tree
 * (e.g. {@code main/.git/worktrees/feature}), so it cannot simply be assumed to be {@code root/.git}.
 */
public final class GitDirResolver {
    private static final Logger logger = LogManager.getLogger(GitDirResolver.class);

    private GitDirResolver() {}

    public static Path resolve(GitExecutor git, Path root) {
        Path fallback = root.resolve(".git");
        try {
            String output = git.runText(root, "rev-parse", "--git-dir").strip();
            if (output.isEmpty()) {
                logger.warn("git rev-parse --git-dir returned nothing in {}; assuming {}", root, fallback);
                return fallback;
            }
            Path gitDir = Path.of(output);
            return gitDir.isAbsolute() ? gitDir.normalize() : root.resolve(gitDir).normalize();
        } catch (GitCommandException e) {
            logger.warn("Unable to resolve git directory for {}; assuming {}: {}", root, fallback, e.getMessage());
            return fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted resolving git directory for {}; assuming {}", root, fallback);
            return fallback;
        }
    }
}
