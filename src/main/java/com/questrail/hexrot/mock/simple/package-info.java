/**
 * A minimal single-axis device: its config and telemetry records and codecs,
 * a mock controller that emulates it, and command builders for link clients.
 */
package com.questrail.hexrot.mock.simple;
