package ai.diffscope.watch;

import java.io.IOException;

/** An open notification channel to one UI client. */
public interface ClientSession {
    /**
     * Delivers one event.
     *
     * @throws IOException if the channel is broken; the session is then dropped
     */
    void send(WatchEvent event) throws IOException;

    /**
     * Writes something the client ignores, so a peer that went away is noticed while nothing is being broadcast.
     *
     * @throws IOException if the channel is broken
     */
    default void ping() throws IOException {}
}
