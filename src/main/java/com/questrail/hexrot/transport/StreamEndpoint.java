package com.questrail.hexrot.transport;

import java.util.concurrent.CompletableFuture;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Port for the connecting side of a framed TCP stream.
 *
 * <p>The endpoint splits the inbound byte stream into header/payload pairs
 * (using the frame sizes it was built with) and hands them to its listener.
 * Higher layers are responsible for:</p>
 * <ul>
 *   <li>decoding headers and payloads into records</li>
 *   <li>correlating command statuses with commands</li>
 *   <li>timeouts on anything they wait for</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Open the connection.
     *
     * <p>The returned future completes after
     * {@link StreamEndpointListener#onTransportUp()} has been delivered, or
     * exceptionally with the connect failure. An endpoint is started at most once.</p>
     */
    CompletableFuture<Void> start();

    /**
     * Close the connection and release all transport resources. Idempotent.
     *
     * <p>If the connection was up, the listener receives
     * {@link StreamEndpointListener#onTransportDown(Throwable)} with a
     * {@code null} cause, at most once per transition.</p>
     */
    void stop();

    boolean isConnected();

    /**
     * Write one complete record to the stream.
     *
     * @return completes when the bytes are flushed, or exceptionally with a
     *         {@link TransportException} if the connection is not up
     */
    CompletableFuture<Void> send(byte[] payload);
}
