package ai.diffscope.git;

import org.jetbrains.annotations.Nullable;

/**
 * Git's per-file summary of a diff: line counts, the binary flag, and the source path of a rename.
 *
 * @param path the new path, exactly as git reported it
 * @param fromPath the old path when git detected a rename or copy, otherwise {@code null}
 */
public record FileSummary(String path, @Nullable String fromPath, int insertions, int deletions, boolean binary) {
    public static FileSummary of(String path, int insertions, int deletions) {
        return new FileSummary(path, null, insertions, deletions, false);
    }

    public static FileSummary binary(String path) {
        return new FileSummary(path, null, 0, 0, true);
    }

    public static FileSummary renamed(String fromPath, String path, int insertions, int deletions) {
        return new FileSummary(path, fromPath, insertions, deletions, false);
    }
}
