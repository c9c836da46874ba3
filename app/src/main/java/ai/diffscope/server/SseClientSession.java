package ai.diffscope.server;

import ai.diffscope.watch.ClientSession;
import ai.diffscope.watch.WatchEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Server-sent-events stream over one HTTP exchange. Each event is written as a single {@code data:} frame. The
 * exchange stays open after the handler returns and is closed when a write fails, at which point the close listener
 * is told so the session can be unregistered.
 */
public class SseClientSession implements ClientSession {
    private final HttpExchange exchange;
    private final ObjectMapper objectMapper;
    private final OutputStream out;
    private final Consumer<SseClientSession> onClose;

    private boolean closed;

    private SseClientSession(HttpExchange exchange, ObjectMapper objectMapper, Consumer<SseClientSession> onClose) {
        this.exchange = exchange;
        this.objectMapper = objectMapper;
        this.out = exchange.getResponseBody();
        this.onClose = onClose;
    }

    /** Sends the event-stream response headers and returns the open session. */
    public static SseClientSession open(
            HttpExchange exchange, ObjectMapper objectMapper, Consumer<SseClientSession> onClose) throws IOException {
        var headers = exchange.getResponseHeaders();
        headers.add("Content-Type", "text/event-stream");
        headers.add("Cache-Control", "no-cache");
        headers.add("Connection", "keep-alive");
        headers.add("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);
        return new SseClientSession(exchange, objectMapper, onClose);
    }

    @Override
    public void send(WatchEvent event) throws IOException {
        write("data: " + objectMapper.writeValueAsString(event) + "\n\n");
    }

    /** Writes an SSE comment line, which browsers discard. */
    @Override
    public void ping() throws IOException {
        write(": ping\n\n");
    }

    private synchronized void write(String frame) throws IOException {
        if (closed) {
            throw new IOException("Session closed");
        }
        try {
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    public synchronized void close() {
        if (!closed) {
            closed = true;
            exchange.close();
            onClose.accept(this);
        }
    }
}
