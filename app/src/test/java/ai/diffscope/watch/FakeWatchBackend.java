package ai.diffscope.watch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/** {@link WatchBackend} whose events are emitted by the test. */
public class FakeWatchBackend implements WatchBackend {
    final Map<Path, Consumer<List<Path>>> subscribers = new ConcurrentHashMap<>();
    final List<Path> unsubscribed = new ArrayList<>();
    final Set<Path> failingRoots = new HashSet<>();

    @Override
    public synchronized WatchSubscription subscribe(Path root, Consumer<List<Path>> onEvents) throws IOException {
        if (failingRoots.contains(root)) {
            throw new IOException("cannot watch " + root);
        }
        subscribers.put(root, onEvents);
        return () -> {
            synchronized (this) {
                unsubscribed.add(root);
            }
            subscribers.remove(root, onEvents);
        };
    }

    public Consumer<List<Path>> subscriber(Path root) {
        var consumer = subscribers.get(root);
        if (consumer == null) {
            throw new AssertionError("no subscription for " + root + "; have " + subscribers.keySet());
        }
        return consumer;
    }

    public void emit(Path root, Path... paths) {
        subscriber(root).accept(List.of(paths));
    }
}
