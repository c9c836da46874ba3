package ai.diffscope.watch;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Notification pushed to UI clients. */
public record WatchEvent(
        @JsonProperty("type") String type,
        @JsonProperty("mode") DiffMode mode,
        @JsonProperty("changeType") ChangeType changeType,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("message") String message) {

    public static final String CONNECTED = "connected";
    public static final String RELOAD = "reload";

    /** Always reported as a {@link ChangeType#FILE} change. */
    public static WatchEvent connected(DiffMode mode) {
        return new WatchEvent(
                CONNECTED,
                mode,
                ChangeType.FILE,
                Instant.now().toString(),
                "Connected to file watcher (%s mode)".formatted(mode.jsonValue()));
    }

    public static WatchEvent reload(DiffMode mode) {
        return new WatchEvent(
                RELOAD,
                mode,
                mode.changeType(),
                Instant.now().toString(),
                "Changes detected in %s mode".formatted(mode.jsonValue()));
    }
}
