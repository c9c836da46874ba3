package ai.diffscope.server.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Thin wrapper around the JDK {@link HttpServer} that turns handler exceptions into JSON error responses and offers
 * JSON and byte response helpers.
 */
public final class SimpleHttpServer {
    private static final Logger logger = LogManager.getLogger(SimpleHttpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final AtomicInteger workerThreadCounter = new AtomicInteger(0);

    private final HttpServer httpServer;
    private final ExecutorService executor;

    /**
     * @param host the address to bind to, e.g. "127.0.0.1"
     * @param port the port to bind to; 0 picks a free port
     * @param threadCount number of worker threads
     * @throws IOException if the address cannot be bound
     */
    public SimpleHttpServer(String host, int port, int threadCount) throws IOException {
        this.httpServer = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.executor = Executors.newFixedThreadPool(threadCount, r -> {
            var t = new Thread(r, "SimpleHttpServer-Worker-" + workerThreadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.httpServer.setExecutor(executor);

        logger.info("SimpleHttpServer created: {}:{} with {} worker threads", host, getPort(), threadCount);
    }

    public static ObjectMapper objectMapper() {
        return objectMapper;
    }

    /** Registers {@code handler} for every request whose path starts with {@code path}. */
    public void registerContext(String path, CheckedHttpHandler handler) {
        this.httpServer.createContext(path, exchange -> {
            try {
                handler.handle(exchange);
            } catch (Exception e) {
                logger.error("Unhandled exception in handler for {}", path, e);
                try {
                    sendJsonResponse(exchange, 500, ErrorPayload.internalError("Internal server error", e));
                } catch (IOException | RuntimeException sendError) {
                    // headers may already be sent
                    logger.debug("Unable to send error response for {}: {}", path, sendError.getMessage());
                    exchange.close();
                }
            }
        });
        logger.debug("Registered context: {}", path);
    }

    public static void sendJsonResponse(HttpExchange exchange, Object responseObject) throws IOException {
        sendJsonResponse(exchange, 200, responseObject);
    }

    public static void sendJsonResponse(HttpExchange exchange, int statusCode, Object responseObject)
            throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json; charset=UTF-8");
        sendBytes(exchange, statusCode, objectMapper.writeValueAsBytes(responseObject));
    }

    public static void sendBytesResponse(HttpExchange exchange, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", contentType);
        sendBytes(exchange, 200, body);
    }

    /** Answers 405 and returns false unless the request is a GET. */
    public static boolean requireGet(HttpExchange exchange) throws IOException {
        if ("GET".equals(exchange.getRequestMethod())) {
            return true;
        }
        sendJsonResponse(
                exchange, 405, ErrorPayload.of(ErrorPayload.Code.METHOD_NOT_ALLOWED, "Method not allowed"));
        return false;
    }

    private static void sendBytes(HttpExchange exchange, int statusCode, byte[] body) throws IOException {
        exchange.sendResponseHeaders(statusCode, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
        exchange.close();
    }

    public void start() {
        this.httpServer.start();
        logger.info("SimpleHttpServer started on port {}", getPort());
    }

    /** @param delaySeconds how long to wait for in-flight exchanges */
    public void stop(int delaySeconds) {
        this.httpServer.stop(delaySeconds);
        this.executor.shutdownNow();
        logger.info("SimpleHttpServer stopped");
    }

    public int getPort() {
        return this.httpServer.getAddress().getPort();
    }

    @FunctionalInterface
    public interface CheckedHttpHandler {
        void handle(HttpExchange exchange) throws Exception;
    }
}
