package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GeneratedStatus(
        @JsonProperty("isGenerated") boolean isGenerated, @JsonProperty("source") GeneratedSource source) {

    public static GeneratedStatus byPath(boolean generated) {
        return new GeneratedStatus(generated, GeneratedSource.PATH);
    }

    public static GeneratedStatus byContent(boolean generated) {
        return new GeneratedStatus(generated, GeneratedSource.CONTENT);
    }
}
