package com.questrail.hexrot.transport.tcp.netty;

import com.questrail.hexrot.transport.TransportException;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import java.util.concurrent.CompletableFuture;

/**
 * Bridges Netty futures to {@link CompletableFuture} so no Netty type crosses
 * the transport port.
 */
final class NettyFutures
{
    private NettyFutures() {}

    static CompletableFuture<Void> toCompletable(ChannelFuture channelFuture, String operation) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        channelFuture.addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                result.complete(null);
            }
            else if (f.isCancelled()) {
                result.completeExceptionally(new TransportException(operation + " cancelled"));
            }
            else {
                result.completeExceptionally(new TransportException(operation + " failed", f.cause()));
            }
        });
        return result;
    }

    static CompletableFuture<Void> notConnected(String operation) {
        return CompletableFuture.failedFuture(new TransportException(operation + " failed: not connected"));
    }
}
