package ai.diffscope.server;

import ai.diffscope.diff.DiffParseException;
import ai.diffscope.diff.DiffParser;
import ai.diffscope.diff.DiffResponse;
import ai.diffscope.git.GitCommandException;
import ai.diffscope.git.GitExecutor;
import ai.diffscope.git.ProcessGitExecutor;
import ai.diffscope.server.http.ErrorPayload;
import ai.diffscope.server.http.SimpleHttpServer;
import ai.diffscope.watch.Broadcaster;
import ai.diffscope.watch.ChangeWatcher;
import ai.diffscope.watch.DiffMode;
import ai.diffscope.watch.NativeWatchBackend;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.google.common.base.Splitter;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.net.URLConnection;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * HTTP front end: serves the parsed diff, per-file lookups and the change-notification stream, and keeps the served
 * diff fresh by invalidating it whenever the {@link ChangeWatcher} reports a change.
 */
public class DiffServer {
    private static final Logger logger = LogManager.getLogger(DiffServer.class);

    public static final String DEFAULT_LISTEN_ADDR = "127.0.0.1:4966";
    private static final String STDIN = "stdin";

    /**
     * Startup configuration.
     *
     * @param base the base revision; {@code baseExplicit} tells whether the user chose it
     * @param patch a patch to serve instead of diffing the repository, or null
     */
    public record Config(
            Path repo,
            String host,
            int port,
            String target,
            String base,
            boolean baseExplicit,
            Duration debounce,
            @Nullable String patch) {}

    /** The {@code /api/diff} body: the parsed diff plus the revisions it was produced for. */
    public record DiffPayload(
            @JsonUnwrapped DiffResponse diff,
            @JsonProperty("ignoreWhitespace") boolean ignoreWhitespace,
            @JsonProperty("mode") DiffMode mode,
            @JsonProperty("baseCommitish") String baseCommitish,
            @JsonProperty("targetCommitish") String targetCommitish,
            @JsonProperty("requestedBaseCommitish") String requestedBaseCommitish,
            @JsonProperty("requestedTargetCommitish") String requestedTargetCommitish) {}

    private record CachedDiff(String target, String base, boolean ignoreWhitespace, DiffResponse response) {}

    private final Config config;
    private final DiffParser parser;
    private final ChangeWatcher watcher;
    private final DiffMode mode;
    private final SimpleHttpServer server;

    private final Object diffLock = new Object();

    @Nullable
    private CachedDiff cachedDiff;

    public DiffServer(Config config, DiffParser parser, ChangeWatcher watcher) throws IOException {
        this.config = config;
        this.parser = parser;
        this.watcher = watcher;
        this.mode = config.patch() != null
                ? DiffMode.SPECIFIC
                : DiffMode.forRevisions(config.target(), config.baseExplicit() ? config.base() : null);
        this.server = new SimpleHttpServer(config.host(), config.port(), 8);

        this.server.registerContext("/health/live", this::handleHealthLive);
        this.server.registerContext("/api/diff", this::handleDiff);
        this.server.registerContext("/api/generated-status/", this::handleGeneratedStatus);
        this.server.registerContext("/api/blob/", this::handleBlob);
        this.server.registerContext("/api/line-count/", this::handleLineCount);
        this.server.registerContext("/api/watch", this::handleWatch);
    }

    public void start() {
        server.start();
        watcher.start(mode, parser.getRepoRoot(), config.debounce(), this::invalidateCaches);
        logger.info(
                "diffscope serving {} vs {} from {} on port {}",
                config.target(),
                config.base(),
                parser.getRepoRoot(),
                server.getPort());
    }

    public void stop(int delaySeconds) {
        watcher.close();
        server.stop(delaySeconds);
    }

    public int getPort() {
        return server.getPort();
    }

    public DiffMode getMode() {
        return mode;
    }

    void invalidateCaches() {
        synchronized (diffLock) {
            cachedDiff = null;
        }
        parser.clearCaches();
        logger.debug("Diff caches invalidated");
    }

    private void handleHealthLive(HttpExchange exchange) throws IOException {
        if (!SimpleHttpServer.requireGet(exchange)) {
            return;
        }
        SimpleHttpServer.sendJsonResponse(exchange, Map.of("status", "live", "mode", mode.jsonValue()));
    }

    private void handleDiff(HttpExchange exchange) throws IOException {
        if (!SimpleHttpServer.requireGet(exchange)) {
            return;
        }
        var params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        boolean ignoreWhitespace = "true".equals(params.get("ignoreWhitespace"));

        if (config.patch() != null) {
            DiffResponse response;
            try {
                response = cachedOrParse(STDIN, STDIN, false);
            } catch (DiffParseException e) {
                SimpleHttpServer.sendJsonResponse(
                        exchange, 400, ErrorPayload.of(ErrorPayload.Code.DIFF_FAILED, e.getMessage()));
                return;
            }
            SimpleHttpServer.sendJsonResponse(
                    exchange, new DiffPayload(response, false, mode, STDIN, STDIN, STDIN, STDIN));
            return;
        }

        String target = params.getOrDefault("target", config.target());
        String base = params.getOrDefault("base", config.base());
        DiffResponse response;
        try {
            response = cachedOrParse(target, base, ignoreWhitespace);
        } catch (DiffParseException e) {
            logger.warn("Diff request failed: {}", e.getMessage());
            SimpleHttpServer.sendJsonResponse(
                    exchange, 400, ErrorPayload.of(ErrorPayload.Code.DIFF_FAILED, e.getMessage()));
            return;
        }
        var payload = new DiffPayload(
                response,
                ignoreWhitespace,
                mode,
                resolveForDisplay(base),
                resolveForDisplay(target),
                base,
                target);
        SimpleHttpServer.sendJsonResponse(exchange, payload);
    }

    private DiffResponse cachedOrParse(String target, String base, boolean ignoreWhitespace)
            throws DiffParseException {
        synchronized (diffLock) {
            var cached = cachedDiff;
            if (cached != null
                    && cached.target().equals(target)
                    && cached.base().equals(base)
                    && cached.ignoreWhitespace() == ignoreWhitespace) {
                return cached.response();
            }
            var patch = config.patch();
            DiffResponse response = patch != null
                    ? parser.parsePatch(patch)
                    : parser.parseDiff(target, base, ignoreWhitespace);
            if (cached != null) {
                // different revisions: generated-status answers belong to the old ones
                parser.clearCaches();
            }
            cachedDiff = new CachedDiff(target, base, ignoreWhitespace, response);
            return response;
        }
    }

    private String resolveForDisplay(String commitish) {
        try {
            return parser.resolveCommitish(commitish);
        } catch (GitCommandException e) {
            logger.debug("Unable to resolve {} for display: {}", commitish, e.getMessage());
            return commitish;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return commitish;
        }
    }

    private void handleGeneratedStatus(HttpExchange exchange) throws IOException {
        if (!SimpleHttpServer.requireGet(exchange)) {
            return;
        }
        if (config.patch() != null) {
            SimpleHttpServer.sendJsonResponse(
                    exchange, 400, ErrorPayload.validationError("Generated status is not available for a patch"));
            return;
        }
        String path = validatedPath(exchange, "/api/generated-status/");
        if (path == null) {
            return;
        }
        var params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String ref = params.getOrDefault("ref", currentTarget());
        var status = parser.getGeneratedStatus(path, ref);

        var response = new LinkedHashMap<String, Object>();
        response.put("path", path);
        response.put("ref", ref);
        response.put("isGenerated", status.isGenerated());
        response.put("source", status.source());
        SimpleHttpServer.sendJsonResponse(exchange, response);
    }

    private void handleBlob(HttpExchange exchange) throws IOException {
        if (!SimpleHttpServer.requireGet(exchange)) {
            return;
        }
        if (config.patch() != null) {
            var error = ErrorPayload.of(ErrorPayload.Code.NOT_FOUND, "Blob content is not available for a patch");
            SimpleHttpServer.sendJsonResponse(exchange, 404, error);
            return;
        }
        String path = validatedPath(exchange, "/api/blob/");
        if (path == null) {
            return;
        }
        var params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String ref = params.getOrDefault("ref", "HEAD");
        byte[] content;
        try {
            content = parser.getBlobContent(path, ref);
        } catch (GitCommandException.OutputTooLargeException e) {
            SimpleHttpServer.sendJsonResponse(
                    exchange, 413, ErrorPayload.of(ErrorPayload.Code.FILE_TOO_LARGE, e.getMessage()));
            return;
        } catch (GitCommandException | NoSuchFileException e) {
            logger.debug("Blob {} at {} not found: {}", path, ref, e.getMessage());
            SimpleHttpServer.sendJsonResponse(
                    exchange, 404, ErrorPayload.of(ErrorPayload.Code.NOT_FOUND, "File not found: " + path));
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted reading " + path, e);
        }
        exchange.getResponseHeaders().add("Cache-Control", "no-cache, no-store, must-revalidate");
        SimpleHttpServer.sendBytesResponse(exchange, contentTypeFor(path), content);
    }

    private void handleLineCount(HttpExchange exchange) throws IOException {
        if (!SimpleHttpServer.requireGet(exchange)) {
            return;
        }
        if (config.patch() != null) {
            var error = ErrorPayload.of(ErrorPayload.Code.NOT_FOUND, "Line count is not available for a patch");
            SimpleHttpServer.sendJsonResponse(exchange, 404, error);
            return;
        }
        String path = validatedPath(exchange, "/api/line-count/");
        if (path == null) {
            return;
        }
        var params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String oldPath = params.getOrDefault("oldPath", path);
        var response = new LinkedHashMap<String, Object>();
        String oldRef = params.get("oldRef");
        if (oldRef != null) {
            response.put("oldLineCount", lineCountOrZero(oldPath, oldRef));
        }
        String newRef = params.get("newRef");
        if (newRef != null) {
            response.put("newLineCount", lineCountOrZero(path, newRef));
        }
        SimpleHttpServer.sendJsonResponse(exchange, response);
    }

    /** A side that does not exist (an added or deleted file) counts as empty. */
    private int lineCountOrZero(String path, String ref) {
        try {
            return parser.getLineCount(path, ref);
        } catch (IOException e) {
            logger.debug("No line count for {} at {}: {}", path, ref, e.getMessage());
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }
    }

    private void handleWatch(HttpExchange exchange) throws IOException {
        if (!SimpleHttpServer.requireGet(exchange)) {
            return;
        }
        var session = SseClientSession.open(exchange, SimpleHttpServer.objectMapper(), watcher::removeClient);
        watcher.addClient(session);
    }

    private String currentTarget() {
        synchronized (diffLock) {
            return cachedDiff != null ? cachedDiff.target() : config.target();
        }
    }

    /** Extracts the repository-relative path after {@code prefix}, answering 400 and returning null if it is unsafe. */
    private @Nullable String validatedPath(HttpExchange exchange, String prefix) throws IOException {
        String requestPath = exchange.getRequestURI().getPath();
        String path = requestPath.length() > prefix.length() ? requestPath.substring(prefix.length()) : "";
        if (!isSafeRelativePath(parser.getRepoRoot(), path)) {
            SimpleHttpServer.sendJsonResponse(
                    exchange, 400, ErrorPayload.validationError("File path outside repository: " + path));
            return null;
        }
        return path.replace('\\', '/');
    }

    static boolean isSafeRelativePath(Path repoRoot, String path) {
        if (path.isEmpty()) {
            return false;
        }
        String normalized = path.replace('\\', '/');
        if (normalized.startsWith("/")) {
            return false;
        }
        for (String segment : Splitter.on('/').split(normalized)) {
            if (segment.equals("..")) {
                return false;
            }
        }
        try {
            Path candidate = Path.of(normalized);
            return !candidate.isAbsolute() && repoRoot.resolve(candidate).normalize().startsWith(repoRoot);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String contentTypeFor(String path) {
        String guessed = URLConnection.guessContentTypeFromName(path);
        return guessed != null ? guessed : "application/octet-stream";
    }

    static Map<String, String> parseQueryParams(@Nullable String query) {
        var params = new HashMap<String, String>();
        if (query == null || query.isBlank()) {
            return params;
        }
        for (var pair : Splitter.on('&').split(query)) {
            var keyValue = Splitter.on('=').limit(2).splitToList(pair);
            var rawKey = keyValue.get(0);
            var rawValue = keyValue.size() > 1 ? keyValue.get(1) : "";
            if (rawKey.isEmpty() || rawValue.isEmpty()) {
                continue;
            }
            params.put(decode(rawKey), decode(rawValue));
        }
        return params;
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    /*
     * Parses --key value and --key=value arguments.
     */
    static Map<String, String> parseArgs(String[] args) {
        var result = new HashMap<String, String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            var withoutPrefix = arg.substring(2);
            String key;
            String value;
            if (withoutPrefix.contains("=")) {
                var parts = Splitter.on('=').limit(2).splitToList(withoutPrefix);
                key = parts.get(0);
                value = parts.size() > 1 ? parts.get(1) : "";
            } else {
                key = withoutPrefix;
                if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    value = args[++i];
                } else {
                    value = "";
                }
            }
            result.put(key, value);
        }
        return result;
    }

    @Nullable
    private static String getConfigValue(Map<String, String> parsedArgs, String argKey, String envVarName) {
        var argValue = parsedArgs.get(argKey);
        if (argValue != null && !argValue.isBlank()) {
            return argValue;
        }
        var envValue = System.getenv(envVarName);
        return envValue == null || envValue.isBlank() ? null : envValue;
    }

    static Config buildConfig(Map<String, String> parsedArgs) throws IOException {
        var repoStr = getConfigValue(parsedArgs, "repo", "DIFFSCOPE_REPO");
        Path repo = Path.of(repoStr != null ? repoStr : ".").toAbsolutePath().normalize();
        if (!Files.isDirectory(repo)) {
            throw new IllegalArgumentException("Repository directory does not exist: " + repo);
        }

        var listenAddr = getConfigValue(parsedArgs, "listen-addr", "DIFFSCOPE_LISTEN_ADDR");
        var parts = Splitter.on(':').splitToList(listenAddr != null ? listenAddr : DEFAULT_LISTEN_ADDR);
        if (parts.size() != 2) {
            throw new IllegalArgumentException("DIFFSCOPE_LISTEN_ADDR must be in format host:port, got: " + listenAddr);
        }
        int port;
        try {
            port = Integer.parseInt(parts.get(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in DIFFSCOPE_LISTEN_ADDR: " + parts.get(1), e);
        }

        var targetValue = getConfigValue(parsedArgs, "target", "DIFFSCOPE_TARGET");
        String target = targetValue != null ? targetValue : "HEAD";
        var baseValue = getConfigValue(parsedArgs, "base", "DIFFSCOPE_BASE");
        String base = baseValue != null ? baseValue : DiffParser.defaultBase(target);

        var debounceValue = getConfigValue(parsedArgs, "debounce-ms", "DIFFSCOPE_DEBOUNCE_MS");
        Duration debounce;
        try {
            debounce = debounceValue != null
                    ? Duration.ofMillis(Long.parseLong(debounceValue))
                    : ChangeWatcher.DEFAULT_DEBOUNCE;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid debounce: " + debounceValue, e);
        }

        String patch = null;
        var patchSource = parsedArgs.get("patch");
        if (patchSource != null && !patchSource.isBlank()) {
            patch = patchSource.equals("-")
                    ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Path.of(patchSource), StandardCharsets.UTF_8);
        }

        return new Config(repo, parts.get(0), port, target, base, baseValue != null, debounce, patch);
    }

    public static void main(String[] args) {
        try {
            var config = buildConfig(parseArgs(args));
            logger.info(
                    "Starting diffscope with config: repo={}, listen={}:{}, target={}, base={}, patch={}",
                    config.repo(),
                    config.host(),
                    config.port(),
                    config.target(),
                    config.base(),
                    config.patch() != null);

            GitExecutor git = new ProcessGitExecutor();
            var parser = new DiffParser(config.repo(), git);
            var watcher = new ChangeWatcher(new NativeWatchBackend(), git, new Broadcaster());
            var diffServer = new DiffServer(config, parser, watcher);
            diffServer.start();

            Runtime.getRuntime()
                    .addShutdownHook(new Thread(
                            () -> {
                                logger.info("Shutdown signal received, stopping diffscope");
                                diffServer.stop(1);
                            },
                            "DiffServer-ShutdownHook"));

            logger.info("diffscope is running at http://{}:{}/", config.host(), diffServer.getPort());
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.info("DiffServer interrupted", e);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Fatal error in DiffServer", e);
            System.exit(1);
        }
    }
}
