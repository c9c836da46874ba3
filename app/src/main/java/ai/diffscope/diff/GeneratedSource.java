package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Which signal decided a {@link GeneratedStatus}. */
public enum GeneratedSource {
    PATH,
    CONTENT;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
