package ai.diffscope.watch;

import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** {@link WatchBackend} on top of the native recursive watchers of io.methvin directory-watcher. */
public class NativeWatchBackend implements WatchBackend {
    private static final Logger logger = LogManager.getLogger(NativeWatchBackend.class);

    @Override
    public WatchSubscription subscribe(Path root, Consumer<List<Path>> onEvents) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        DirectoryWatcher watcher = DirectoryWatcher.builder()
                .paths(List.of(root))
                .listener(event -> handleEvent(root, event, onEvents))
                .fileHashing(false)
                .build();

        ExecutorService watchExecutor = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, "DirectoryWatcher@" + root.getFileName());
            thread.setDaemon(true);
            return thread;
        });
        logger.debug("Starting native directory watcher for {}", root);
        watcher.watchAsync(watchExecutor).whenComplete((ignored, error) -> {
            if (error != null) {
                logger.error("Native directory watcher for {} failed", root, error);
            }
        });

        return () -> {
            logger.debug("Closing native directory watcher for {}", root);
            try {
                watcher.close();
            } finally {
                watchExecutor.shutdownNow();
            }
        };
    }

    private static void handleEvent(Path root, DirectoryChangeEvent event, Consumer<List<Path>> onEvents) {
        if (event.eventType() == DirectoryChangeEvent.EventType.OVERFLOW) {
            logger.warn("Event overflow while watching {}; some changes may have been missed", root);
            return;
        }
        Path changed = event.path();
        if (changed == null) {
            return;
        }
        logger.trace("File event: {} on {}", event.eventType(), changed);
        try {
            onEvents.accept(List.of(changed));
        } catch (RuntimeException e) {
            logger.error("Error handling directory change event for {}", changed, e);
        }
    }
}
