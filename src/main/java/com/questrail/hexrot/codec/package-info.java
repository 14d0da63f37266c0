/**
 * Hexapod/Rotator Wire Codecs
 * =============================================================================
 *
 * <p>This package defines the <strong>codec ports</strong> for the binary
 * command/telemetry protocol spoken by hexapod and rotator motion controllers.
 * Every record on the wire is fixed size and byte packed, little-endian:</p>
 *
 * <pre>
 *   link -> controller:   Command                       (60 bytes)
 *   controller -> link:   Header (22 bytes) + payload
 *                            COMMAND_STATUS  (62 bytes)
 *                            CONFIG          (device-defined)
 *                            TELEMETRY       (device-defined)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Codecs see only {@code byte[]}/{@link java.nio.ByteBuffer}; they never
 *       touch sockets or Netty buffers.</li>
 *   <li>Stream splitting (how many bytes follow a header) is driven by
 *       {@link com.questrail.hexrot.codec.impl.FrameCatalog}, which the transport
 *       adapter consults.</li>
 *   <li>A record that ends early is a transport failure, not a codec failure;
 *       codecs are only ever handed complete records.</li>
 * </ul>
 */
package com.questrail.hexrot.codec;
