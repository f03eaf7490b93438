package com.phillippitts.sttguard.service.events;

import java.time.Instant;

/**
 * Published when a connection is closed because its integrity failures exceeded the
 * corruption threshold.
 *
 * @param clientId client address, e.g. {@code 10.0.0.7:53122}
 * @param failureCount failures seen on the connection, including the one that triggered rejection
 * @param threshold configured corruption threshold
 * @param detail expected/actual comparison of the last failing frame
 * @param at when the rejection happened
 */
public record ConnectionRejectedEvent(
        String clientId,
        int failureCount,
        int threshold,
        String detail,
        Instant at
) {}
