package com.questrail.hexrot.codec.impl;

import com.questrail.hexrot.mock.simple.SimpleConfigCodec;
import com.questrail.hexrot.mock.simple.SimpleTelemetryCodec;
import com.questrail.hexrot.model.FrameId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FrameCatalogTest
{
    private final FrameCatalog catalog = FrameCatalog.of(
            CommandStatusCodec.INSTANCE, SimpleConfigCodec.INSTANCE, SimpleTelemetryCodec.INSTANCE);

    @Test
    void knownFramesReportPayloadSize()
    {
        assertEquals(62, catalog.payloadSize(FrameId.COMMAND_STATUS.wireValue()).getAsInt());
        assertEquals(24, catalog.payloadSize(FrameId.CONFIG.wireValue()).getAsInt());
        assertEquals(28, catalog.payloadSize(FrameId.TELEMETRY.wireValue()).getAsInt());
        assertEquals(22, catalog.headerSize());
    }

    @Test
    void unknownFrameHasNoSize()
    {
        assertTrue(catalog.payloadSize(0x42).isEmpty());
    }

    @Test
    void resyncSkipsLargestPayload()
    {
        assertEquals(62, catalog.resyncSize());
    }

    @Test
    void duplicateFrameIdRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> FrameCatalog.of(SimpleConfigCodec.INSTANCE, SimpleConfigCodec.INSTANCE));
    }

    @Test
    void emptyCatalogRejected()
    {
        assertThrows(IllegalArgumentException.class, FrameCatalog::of);
    }
}
