package fr.lapetina.mesh.coordinator.infrastructure.transport;

import fr.lapetina.mesh.coordinator.domain.model.Node;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Point-to-point messaging with remote nodes.
 *
 * Implementations must be thread-safe. The returned future completes with the
 * node's reply, or exceptionally with {@link TransientNetworkException} when
 * the node could not be reached within the timeout. Replies with an error
 * status are returned normally; callers classify them.
 */
public interface Transport extends AutoCloseable {

    CompletableFuture<TransportReply> send(Node node, TransportMessage message, Duration timeout);

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException}
     * wrappers added by future composition.
     */
    static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    default void close() {
        // Default no-op
    }
}
