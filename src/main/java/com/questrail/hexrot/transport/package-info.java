/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete TCP implementation (Netty, or a test double) and the
 * link and mock controller.
 *
 * <h2>Netty containment</h2>
 * Netty does all socket I/O in production, but its types never appear above
 * this boundary. Everything above it sees only:
 * <ul>
 *   <li>complete records as {@code byte[]}</li>
 *   <li>connection lifecycle notifications</li>
 *   <li>{@link java.util.concurrent.CompletableFuture} for asynchronous completion</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations split the stream into records and do nothing else: no
 * record decoding, no command correlation, no retries, no timeouts beyond the
 * TCP connect timeout.
 */
package com.questrail.hexrot.transport;
