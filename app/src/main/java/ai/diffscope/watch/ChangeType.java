package ai.diffscope.watch;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What kind of change a reload notification reports. Fixed per {@link DiffMode}. */
public enum ChangeType {
    FILE,
    COMMIT,
    STAGING;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
