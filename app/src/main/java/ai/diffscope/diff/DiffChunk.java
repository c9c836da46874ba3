package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** A parsed hunk. {@code header} is the full {@code @@ ... @@} line including any trailing section heading. */
public record DiffChunk(
        @JsonProperty("header") String header,
        @JsonProperty("oldStart") int oldStart,
        @JsonProperty("oldLines") int oldLines,
        @JsonProperty("newStart") int newStart,
        @JsonProperty("newLines") int newLines,
        @JsonProperty("lines") List<DiffLine> lines) {

    public DiffChunk {
        lines = List.copyOf(lines);
    }
}
