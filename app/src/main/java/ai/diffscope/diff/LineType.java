package ai.diffscope.diff;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum LineType {
    ADD,
    DELETE,
    NORMAL;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
