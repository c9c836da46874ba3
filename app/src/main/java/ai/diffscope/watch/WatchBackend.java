package ai.diffscope.watch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Source of raw filesystem events. Implementations deliver absolute paths of changed entries below {@code root},
 * in batches, on a thread of their choosing.
 */
public interface WatchBackend {
    WatchSubscription subscribe(Path root, Consumer<List<Path>> onEvents) throws IOException;
}
