package ai.diffscope.watch;

import ai.diffscope.git.GitCommandException;
import ai.diffscope.git.GitDirResolver;
import ai.diffscope.git.GitExecutor;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Watches a repository for changes that affect the displayed diff and turns bursts of filesystem events into a single
 * invalidation followed by a single reload notification.
 *
 * <p>All event handling runs on one event-loop thread. Backend callbacks are posted onto it; relevance filtering,
 * debounce arming and firing happen there, so the debounce slot needs no further coordination.
 */
public class ChangeWatcher implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ChangeWatcher.class);

    public static final Duration DEFAULT_DEBOUNCE =
            Duration.ofMillis(Long.getLong("diffscope.watch.debounceMs", 300));

    public static final Duration DEFAULT_HEARTBEAT =
            Duration.ofMillis(Long.getLong("diffscope.watch.heartbeatMs", 15_000));

    private static final String GIT_DIR_ALIAS = ".git";

    private enum RootKind {
        WORK_TREE,
        GIT_DIR
    }

    /** Everything one {@link #start} call configured. Events from an earlier start are recognised and ignored. */
    private record WatchConfig(
            DiffMode mode,
            Path root,
            Path gitDir,
            List<GlobMatcher> ignores,
            Duration debounce,
            Runnable onInvalidate) {}

    private final WatchBackend backend;
    private final GitExecutor git;
    private final Broadcaster broadcaster;
    private final ScheduledExecutorService eventLoop;

    private final Object lock = new Object();
    private final List<WatchSubscription> subscriptions = new ArrayList<>();

    @Nullable
    private volatile WatchConfig active;

    @Nullable
    private ScheduledFuture<?> pendingInvalidation;

    private volatile DiffMode currentMode = DiffMode.DEFAULT;

    public ChangeWatcher(WatchBackend backend, GitExecutor git, Broadcaster broadcaster) {
        this(backend, git, broadcaster, DEFAULT_HEARTBEAT);
    }

    /** @param heartbeat how often connected clients are pinged, in every mode including {@link DiffMode#SPECIFIC} */
    public ChangeWatcher(WatchBackend backend, GitExecutor git, Broadcaster broadcaster, Duration heartbeat) {
        if (heartbeat.isNegative() || heartbeat.isZero()) {
            throw new IllegalArgumentException("heartbeat must be positive: " + heartbeat);
        }
        this.backend = backend;
        this.git = git;
        this.broadcaster = broadcaster;
        this.eventLoop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "diffscope-watch");
            thread.setDaemon(true);
            return thread;
        });
        long periodMillis = heartbeat.toMillis();
        eventLoop.scheduleAtFixedRate(broadcaster::ping, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Starts watching {@code root} according to {@code mode}, replacing any earlier watch. Roots that cannot be
     * subscribed are logged and skipped.
     */
    public void start(DiffMode mode, Path root, Duration debounce, Runnable onInvalidate) {
        synchronized (lock) {
            teardown();
            currentMode = mode;
            if (mode == DiffMode.SPECIFIC) {
                logger.info("Comparing fixed revisions; file watching disabled");
                return;
            }

            Path absoluteRoot = root.toAbsolutePath().normalize();
            Path gitDir = GitDirResolver.resolve(git, absoluteRoot).toAbsolutePath().normalize();
            var config = new WatchConfig(
                    mode, absoluteRoot, gitDir, GlobMatcher.compileAll(mode.ignoreGlobs()), debounce, onInvalidate);
            active = config;

            if (mode.watchesWorkTree()) {
                subscribe(config, absoluteRoot, RootKind.WORK_TREE);
            }
            if (mode.watchesGitDir()) {
                subscribe(config, gitDir, RootKind.GIT_DIR);
            }
            logger.info(
                    "Watching {} in {} mode ({} roots, debounce {} ms)",
                    absoluteRoot,
                    mode.jsonValue(),
                    subscriptions.size(),
                    debounce.toMillis());
        }
    }

    /** Stops watching and drops all clients. Safe to call repeatedly and before {@link #start}. */
    public void stop() {
        synchronized (lock) {
            teardown();
        }
        broadcaster.clear();
    }

    public void addClient(ClientSession session) {
        broadcaster.addClient(session, currentMode);
    }

    public void removeClient(ClientSession session) {
        broadcaster.removeClient(session);
    }

    public DiffMode getCurrentMode() {
        return currentMode;
    }

    public boolean isWatching() {
        return active != null;
    }

    @Override
    public void close() {
        stop();
        eventLoop.shutdownNow();
    }

    private void subscribe(WatchConfig config, Path watchRoot, RootKind kind) {
        try {
            subscriptions.add(backend.subscribe(watchRoot, paths -> post(config, kind, paths)));
            logger.debug("Subscribed to {} ({})", watchRoot, kind);
        } catch (IOException | RuntimeException e) {
            logger.warn("Unable to watch {}: {}", watchRoot, e.getMessage());
        }
    }

    private void post(WatchConfig config, RootKind kind, List<Path> paths) {
        try {
            eventLoop.execute(() -> handleEvents(config, kind, paths));
        } catch (RejectedExecutionException e) {
            logger.debug("Event loop closed; dropping {} events", paths.size());
        }
    }

    private void handleEvents(WatchConfig config, RootKind kind, List<Path> paths) {
        if (config != active) {
            return;
        }
        for (Path path : paths) {
            if (isRelevant(config, kind, path)) {
                armDebounce(config);
                return;
            }
        }
    }

    private boolean isRelevant(WatchConfig config, RootKind kind, Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        String relativePath;
        if (kind == RootKind.GIT_DIR) {
            if (!absolute.startsWith(config.gitDir())) {
                return false;
            }
            // expressed as .git/... so the ignore globs also hold for linked worktrees
            String inGitDir = toSlashPath(config.gitDir().relativize(absolute));
            relativePath = inGitDir.isEmpty() ? GIT_DIR_ALIAS : GIT_DIR_ALIAS + "/" + inGitDir;
        } else {
            if (!absolute.startsWith(config.root()) || absolute.startsWith(config.gitDir())) {
                return false;
            }
            relativePath = toSlashPath(config.root().relativize(absolute));
            if (relativePath.isEmpty()) {
                return false;
            }
        }

        for (GlobMatcher ignore : config.ignores()) {
            if (ignore.matches(relativePath)) {
                logger.trace("Ignoring {} (matches {})", relativePath, ignore);
                return false;
            }
        }

        if (kind == RootKind.WORK_TREE) {
            if (isGitIgnored(config.root(), relativePath)) {
                logger.trace("Ignoring {} (gitignored)", relativePath);
                return false;
            }
            logger.debug("Relevant working tree change: {}", relativePath);
            return true;
        }

        Path fileName = absolute.getFileName();
        boolean relevant = fileName != null && config.mode().isRelevantGitFile(fileName.toString());
        if (relevant) {
            logger.debug("Relevant git metadata change: {}", relativePath);
        }
        return relevant;
    }

    /** {@code git check-ignore} exits 0 for ignored paths; any failure counts as not ignored. */
    private boolean isGitIgnored(Path root, String relativePath) {
        try {
            git.runText(root, "check-ignore", "-q", "--", relativePath);
            return true;
        } catch (GitCommandException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void armDebounce(WatchConfig config) {
        synchronized (lock) {
            if (config != active) {
                return;
            }
            if (pendingInvalidation != null) {
                pendingInvalidation.cancel(false);
            }
            pendingInvalidation = eventLoop.schedule(
                    () -> fire(config), config.debounce().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void fire(WatchConfig config) {
        synchronized (lock) {
            if (config != active) {
                return;
            }
            pendingInvalidation = null;
        }
        logger.debug("Debounce elapsed; invalidating caches for {} mode", config.mode().jsonValue());
        try {
            config.onInvalidate().run();
        } catch (RuntimeException e) {
            logger.error("Error invalidating caches", e);
        }
        broadcaster.broadcast(WatchEvent.reload(config.mode()));
    }

    // callers hold lock
    private void teardown() {
        active = null;
        if (pendingInvalidation != null) {
            pendingInvalidation.cancel(false);
            pendingInvalidation = null;
        }
        for (WatchSubscription subscription : subscriptions) {
            try {
                subscription.unsubscribe();
            } catch (IOException | RuntimeException e) {
                logger.warn("Error closing watch subscription: {}", e.getMessage());
            }
        }
        subscriptions.clear();
    }

    private static String toSlashPath(Path relative) {
        var parts = new ArrayList<String>(relative.getNameCount());
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }
}
