package com.questrail.hexrot.transport;

/**
 * Callback sink for {@link SingleClientServer}.
 */
public interface SingleClientServerListener
{
    /**
     * Called on each transition between "a peer is connected" and "no peer".
     */
    void onConnectionChange(boolean connected);

    /**
     * Called for each complete fixed-size record read from the current peer.
     */
    void onRecord(byte[] record);
}
