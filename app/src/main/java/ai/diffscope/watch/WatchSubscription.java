package ai.diffscope.watch;

import java.io.IOException;

/** Handle on one watched root. */
public interface WatchSubscription extends AutoCloseable {
    void unsubscribe() throws IOException;

    @Override
    default void close() throws IOException {
        unsubscribe();
    }
}
