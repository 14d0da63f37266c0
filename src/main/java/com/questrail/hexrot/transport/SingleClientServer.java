package com.questrail.hexrot.transport;

import java.util.concurrent.CompletableFuture;

/**
 * SingleClientServer
 * -----------------------------------------------------------------------------
 * Port for a listening socket that serves at most one peer at a time.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>A connection arriving while a live peer exists is closed at once; the
 *       existing peer is not disturbed.</li>
 *   <li>{@link SingleClientServerListener#onConnectionChange(boolean)} fires
 *       only when the connected state actually changes.</li>
 *   <li>Inbound bytes are delivered as fixed-size records.</li>
 * </ul>
 */
public interface SingleClientServer
{
    void setListener(SingleClientServerListener listener);

    /**
     * Bind and begin listening. Returns once the socket is bound.
     *
     * @throws TransportException    if the address cannot be bound
     * @throws IllegalStateException if already started or closed
     */
    void start();

    /**
     * The bound port; meaningful after {@link #start()}, including when the
     * configured port was 0.
     */
    int port();

    boolean isConnected();

    /**
     * Write the given parts back to back to the current peer, as one flush.
     *
     * @return completes when flushed, or exceptionally with a
     *         {@link TransportException} when there is no peer
     */
    CompletableFuture<Void> send(byte[]... parts);

    /**
     * Drop the current peer, if any. The server keeps listening.
     */
    void closeClient();

    /**
     * Drop the current peer and stop listening. Idempotent.
     */
    void close();
}
