package com.questrail.hexrot.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * UTC wall-clock source, used to stamp frame headers and observability
 * events. It may jump (NTP, manual setting) and must never pace or bound
 * protocol activity.
 */
public interface WallClock
{
    Instant now();
}
