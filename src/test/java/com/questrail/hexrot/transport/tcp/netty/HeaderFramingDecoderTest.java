package com.questrail.hexrot.transport.tcp.netty;

import com.questrail.hexrot.codec.impl.CommandStatusCodec;
import com.questrail.hexrot.codec.impl.FrameCatalog;
import com.questrail.hexrot.codec.impl.HeaderCodec;
import com.questrail.hexrot.mock.simple.SimpleConfig;
import com.questrail.hexrot.mock.simple.SimpleConfigCodec;
import com.questrail.hexrot.mock.simple.SimpleTelemetryCodec;
import com.questrail.hexrot.model.CommandStatus;
import com.questrail.hexrot.model.FrameId;
import com.questrail.hexrot.model.Header;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HeaderFramingDecoderTest
 * -----------------------------------------------------------------------------
 * Stream splitting, resynchronization after unknown frame ids and truncation
 * at end of stream, driven through an {@link EmbeddedChannel}.
 */
final class HeaderFramingDecoderTest
{
    private final FrameCatalog catalog = FrameCatalog.of(
            CommandStatusCodec.INSTANCE, SimpleConfigCodec.INSTANCE, SimpleTelemetryCodec.INSTANCE);

    private final EmbeddedChannel channel = new EmbeddedChannel(new HeaderFramingDecoder(catalog));

    @Test
    void splitsConsecutiveFrames()
    {
        byte[] stream = concat(
                frame(FrameId.CONFIG, 0, SimpleConfigCodec.INSTANCE.encode(SimpleConfig.DEFAULT)),
                frame(FrameId.COMMAND_STATUS, 4, CommandStatusCodec.INSTANCE.encode(CommandStatus.ack(1))));

        channel.writeInbound(Unpooled.wrappedBuffer(stream));

        HeaderFramingDecoder.Frame config = channel.readInbound();
        assertEquals(FrameId.CONFIG.wireValue(), HeaderCodec.peekFrameId(config.header()));
        assertEquals(SimpleConfig.DEFAULT, SimpleConfigCodec.INSTANCE.decode(config.payload()));

        HeaderFramingDecoder.Frame status = channel.readInbound();
        assertEquals(4, HeaderCodec.INSTANCE.decode(status.header()).counter());
        assertNull(channel.readInbound());
    }

    @Test
    void reassemblesFrameArrivingByteByByte()
    {
        byte[] stream = frame(FrameId.CONFIG, 0, SimpleConfigCodec.INSTANCE.encode(SimpleConfig.DEFAULT));

        for (byte b : stream) {
            channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { b }));
        }

        HeaderFramingDecoder.Frame config = channel.readInbound();
        assertArrayEquals(SimpleConfigCodec.INSTANCE.encode(SimpleConfig.DEFAULT), config.payload());
    }

    @Test
    void unknownFrameIdDiscardsResyncSizeThenContinues()
    {
        byte[] unknownHeader = HeaderCodec.INSTANCE.encode(new Header(0x42, 0, 0, 0));
        byte[] junk = new byte[catalog.resyncSize()];
        byte[] next = frame(FrameId.CONFIG, 1, SimpleConfigCodec.INSTANCE.encode(SimpleConfig.DEFAULT));

        channel.writeInbound(Unpooled.wrappedBuffer(concat(unknownHeader, junk, next)));

        HeaderFramingDecoder.UnrecognizedFrame unknown = channel.readInbound();
        assertEquals(0x42, unknown.frameId());
        assertEquals(62, unknown.discardedBytes());

        HeaderFramingDecoder.Frame config = channel.readInbound();
        assertEquals(1, HeaderCodec.INSTANCE.decode(config.header()).counter());
    }

    @Test
    void discardSpansSeveralReads()
    {
        channel.writeInbound(Unpooled.wrappedBuffer(HeaderCodec.INSTANCE.encode(new Header(0x42, 0, 0, 0))));
        channel.writeInbound(Unpooled.wrappedBuffer(new byte[40]));
        channel.writeInbound(Unpooled.wrappedBuffer(concat(new byte[22],
                frame(FrameId.CONFIG, 2, SimpleConfigCodec.INSTANCE.encode(SimpleConfig.DEFAULT)))));

        assertInstanceOf(HeaderFramingDecoder.UnrecognizedFrame.class, channel.readInbound());
        HeaderFramingDecoder.Frame config = channel.readInbound();
        assertEquals(2, HeaderCodec.INSTANCE.decode(config.header()).counter());
    }

    @Test
    void endOfStreamMidPayloadIsReported()
    {
        byte[] whole = frame(FrameId.CONFIG, 0, SimpleConfigCodec.INSTANCE.encode(SimpleConfig.DEFAULT));
        byte[] partial = new byte[whole.length - 5];
        System.arraycopy(whole, 0, partial, 0, partial.length);

        channel.writeInbound(Unpooled.wrappedBuffer(partial));
        assertNull(channel.readInbound());

        channel.finish();

        HeaderFramingDecoder.TruncatedStream truncated = channel.readInbound();
        assertEquals(19, truncated.bufferedBytes());
    }

    @Test
    void cleanEndOfStreamReportsNothing()
    {
        channel.writeInbound(Unpooled.wrappedBuffer(
                frame(FrameId.CONFIG, 0, SimpleConfigCodec.INSTANCE.encode(SimpleConfig.DEFAULT))));
        assertNotNull(channel.readInbound());

        channel.finish();

        assertNull(channel.readInbound());
    }

    private static byte[] frame(FrameId id, long counter, byte[] payload)
    {
        return concat(HeaderCodec.INSTANCE.encode(new Header(id.wireValue(), counter, 0, 0)), payload);
    }

    private static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
