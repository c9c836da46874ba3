package ai.diffscope.watch;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Fans events out to every connected {@link ClientSession}. A failing session is dropped without affecting others. */
public class Broadcaster {
    private static final Logger logger = LogManager.getLogger(Broadcaster.class);

    private final List<ClientSession> sessions = new CopyOnWriteArrayList<>();

    public void addClient(ClientSession session, DiffMode mode) {
        sessions.add(session);
        logger.debug("Client connected ({} total)", sessions.size());
        deliver(session, WatchEvent.connected(mode));
    }

    public void removeClient(ClientSession session) {
        if (sessions.remove(session)) {
            logger.debug("Client disconnected ({} remaining)", sessions.size());
        }
    }

    public void broadcast(WatchEvent event) {
        logger.debug("Broadcasting {} event to {} clients", event.type(), sessions.size());
        for (ClientSession session : sessions) {
            deliver(session, event);
        }
    }

    /** Pings every session and drops the ones that no longer accept writes. */
    public void ping() {
        for (ClientSession session : sessions) {
            try {
                session.ping();
            } catch (IOException | RuntimeException e) {
                logger.debug("Dropping client after failed ping: {}", e.getMessage());
                removeClient(session);
            }
        }
    }

    public int clientCount() {
        return sessions.size();
    }

    public void clear() {
        sessions.clear();
    }

    private void deliver(ClientSession session, WatchEvent event) {
        try {
            session.send(event);
        } catch (IOException | RuntimeException e) {
            logger.debug("Dropping client after failed delivery: {}", e.getMessage());
            sessions.remove(session);
        }
    }
}
