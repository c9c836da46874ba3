package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of one diff parse.
 *
 * @param commit human-readable label of the compared revisions
 */
public record DiffResponse(
        @JsonProperty("commit") String commit,
        @JsonProperty("files") List<DiffFile> files,
        @JsonProperty("isEmpty") boolean isEmpty) {

    public DiffResponse {
        files = List.copyOf(files);
        if (isEmpty != files.isEmpty()) {
            throw new IllegalArgumentException("isEmpty must reflect the file list");
        }
    }

    public static DiffResponse of(String commit, List<DiffFile> files) {
        return new DiffResponse(commit, files, files.isEmpty());
    }
}
