/**
 * Concrete codecs for the records every device shares: {@code Header},
 * {@code Command} and {@code CommandStatus}, plus the {@link
 * com.questrail.hexrot.codec.impl.FrameCatalog} used to split the inbound stream.
 *
 * <p>Device-specific config and telemetry codecs live with their device
 * (see {@code com.questrail.hexrot.mock.simple}).</p>
 */
package com.questrail.hexrot.codec.impl;
