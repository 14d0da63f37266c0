package com.questrail.hexrot.transport.tcp.netty;

import com.questrail.hexrot.codec.impl.FrameCatalog;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * HeaderFramingDecoder
 * -----------------------------------------------------------------------------
 * Splits the controller-to-link byte stream into header/payload pairs.
 *
 * <p>Reads one header, looks up the payload size for its frame id in the
 * {@link FrameCatalog}, then reads exactly that many bytes. A frame id the
 * catalog does not know produces an {@link UnrecognizedFrame} and the next
 * {@link FrameCatalog#resyncSize()} bytes are skipped, however they arrive.</p>
 *
 * <p>If the stream ends part way through a header, payload or discard, a
 * {@link TruncatedStream} is emitted as the last message.</p>
 *
 * <p>Emits only {@code byte[]}-based records; no {@link ByteBuf} leaves this class.</p>
 */
final class HeaderFramingDecoder extends ByteToMessageDecoder
{
    record Frame(byte[] header, byte[] payload) {}

    record UnrecognizedFrame(int frameId, int discardedBytes) {}

    record TruncatedStream(int bufferedBytes) {}

    private enum Phase { HEADER, PAYLOAD, DISCARD }

    private final FrameCatalog catalog;

    private Phase phase = Phase.HEADER;
    private byte[] header;
    private int payloadSize;
    private int remainingDiscard;

    HeaderFramingDecoder(FrameCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (true) {
            switch (phase) {
                case HEADER -> {
                    if (in.readableBytes() < catalog.headerSize()) {
                        return;
                    }
                    header = new byte[catalog.headerSize()];
                    in.readBytes(header);

                    int frameId = catalog.frameIdOf(header);
                    OptionalInt size = catalog.payloadSize(frameId);
                    if (size.isPresent()) {
                        payloadSize = size.getAsInt();
                        phase = Phase.PAYLOAD;
                    }
                    else {
                        header = null;
                        remainingDiscard = catalog.resyncSize();
                        phase = Phase.DISCARD;
                        out.add(new UnrecognizedFrame(frameId, remainingDiscard));
                    }
                }
                case PAYLOAD -> {
                    if (in.readableBytes() < payloadSize) {
                        return;
                    }
                    byte[] payload = new byte[payloadSize];
                    in.readBytes(payload);
                    out.add(new Frame(header, payload));
                    header = null;
                    phase = Phase.HEADER;
                }
                case DISCARD -> {
                    int n = Math.min(in.readableBytes(), remainingDiscard);
                    in.skipBytes(n);
                    remainingDiscard -= n;
                    if (remainingDiscard > 0) {
                        return;
                    }
                    phase = Phase.HEADER;
                }
            }
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.isReadable()) {
            decode(ctx, in, out);
        }
        int leftover = in.readableBytes();
        if (leftover > 0 || phase != Phase.HEADER) {
            in.skipBytes(leftover);
            out.add(new TruncatedStream(leftover));
        }
    }
}
