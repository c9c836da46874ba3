package ai.diffscope.watch;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Watching profile for a requested revision range: which roots to watch, which paths are noise, which git metadata
 * files signal a change, and how a change is reported.
 */
public enum DiffMode {
    /** A commit against its parent or another commit; only a moving HEAD matters. */
    DEFAULT(false, true, List.of(".git/objects/**", ".git/refs/**", "node_modules/**"), Set.of("HEAD"),
            ChangeType.COMMIT),
    /** Unstaged changes. */
    WORKING(true, true, List.of(".git/objects/**", ".git/refs/**", "node_modules/**"), Set.of("HEAD", "index"),
            ChangeType.FILE),
    /** Staged changes against a base. */
    STAGED(false, true, List.of(".git/objects/**", ".git/refs/**"), Set.of("HEAD", "index"), ChangeType.STAGING),
    /** All uncommitted changes against a base. */
    DOT(
            true,
            true,
            List.of(
                    ".git/objects/**",
                    ".git/refs/**",
                    "node_modules/**",
                    ".git/FETCH_HEAD",
                    ".git/ORIG_HEAD",
                    ".git/logs/**"),
            Set.of("HEAD"),
            ChangeType.COMMIT),
    /** Two fixed commits; nothing can change, so nothing is watched. */
    SPECIFIC(false, false, List.of(), Set.of(), ChangeType.FILE);

    private final boolean watchWorkTree;
    private final boolean watchGitDir;
    private final List<String> ignoreGlobs;
    private final Set<String> relevantGitFiles;
    private final ChangeType changeType;

    DiffMode(
            boolean watchWorkTree,
            boolean watchGitDir,
            List<String> ignoreGlobs,
            Set<String> relevantGitFiles,
            ChangeType changeType) {
        this.watchWorkTree = watchWorkTree;
        this.watchGitDir = watchGitDir;
        this.ignoreGlobs = ignoreGlobs;
        this.relevantGitFiles = relevantGitFiles;
        this.changeType = changeType;
    }

    public boolean watchesWorkTree() {
        return watchWorkTree;
    }

    public boolean watchesGitDir() {
        return watchGitDir;
    }

    public List<String> ignoreGlobs() {
        return ignoreGlobs;
    }

    public boolean isRelevantGitFile(String fileName) {
        return relevantGitFiles.contains(fileName);
    }

    public ChangeType changeType() {
        return changeType;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Picks the mode for a target revision. Comparing two explicit commits needs no watching, except when the
     * target is HEAD (which moves) or {@code .} (the working tree).
     *
     * @param explicitBase the base revision if the user chose one, {@code null} if it was defaulted
     */
    public static DiffMode forRevisions(String target, @Nullable String explicitBase) {
        if (explicitBase != null && !target.equals("HEAD") && !target.equals(".")) {
            return SPECIFIC;
        }
        return switch (target) {
            case "working" -> WORKING;
            case "staged" -> STAGED;
            case "." -> DOT;
            default -> DEFAULT;
        };
    }
}
