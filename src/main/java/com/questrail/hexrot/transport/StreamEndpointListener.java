package com.questrail.hexrot.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks are delivered serially, in wire order. Netty endpoints deliver
 * them on the channel's event loop, so implementations must not block.</p>
 */
public interface StreamEndpointListener
{
    void onTransportUp();

    /**
     * Called once when a connection that was up becomes unusable.
     *
     * @param cause the failure, an {@link java.io.EOFException} if the stream
     *              ended in the middle of a frame, or {@code null} for an
     *              orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for each complete frame whose id is known.
     *
     * @param header  the encoded header, exactly the header size
     * @param payload the encoded payload, exactly the size declared for its frame id
     */
    void onFrame(byte[] header, byte[] payload);

    /**
     * Called when a header named a frame id with no declared size. The endpoint
     * discards {@code discardedBytes} bytes after that header before reading the
     * next one.
     */
    void onUnrecognizedFrame(int frameId, int discardedBytes);
}
