package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * One body line of a hunk with its marker stripped. Added lines have no old line number and deleted lines have no
 * new line number.
 */
public record DiffLine(
        @JsonProperty("type") LineType type,
        @JsonProperty("content") String content,
        @JsonProperty("oldLineNumber") @Nullable Integer oldLineNumber,
        @JsonProperty("newLineNumber") @Nullable Integer newLineNumber) {

    public static DiffLine added(String content, int newLineNumber) {
        return new DiffLine(LineType.ADD, content, null, newLineNumber);
    }

    public static DiffLine deleted(String content, int oldLineNumber) {
        return new DiffLine(LineType.DELETE, content, oldLineNumber, null);
    }

    public static DiffLine context(String content, int oldLineNumber, int newLineNumber) {
        return new DiffLine(LineType.NORMAL, content, oldLineNumber, newLineNumber);
    }
}
