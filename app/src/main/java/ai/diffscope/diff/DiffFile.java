package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One changed file of a diff.
 *
 * @param oldPath set only for renames, and then always different from {@code path}
 * @param isGenerated path-based classification only; content-based classification is queried separately
 */
public record DiffFile(
        @JsonProperty("path") String path,
        @JsonProperty("oldPath") @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String oldPath,
        @JsonProperty("status") FileStatus status,
        @JsonProperty("additions") int additions,
        @JsonProperty("deletions") int deletions,
        @JsonProperty("chunks") List<DiffChunk> chunks,
        @JsonProperty("isGenerated") boolean isGenerated) {

    public DiffFile {
        chunks = List.copyOf(chunks);
        if (oldPath != null && (status != FileStatus.RENAMED || oldPath.equals(path))) {
            throw new IllegalArgumentException("oldPath is only valid for a rename to a different path: " + oldPath);
        }
    }
}
