package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FileStatus {
    ADDED,
    DELETED,
    MODIFIED,
    RENAMED;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
