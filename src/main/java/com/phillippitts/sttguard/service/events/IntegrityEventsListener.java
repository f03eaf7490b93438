package com.phillippitts.sttguard.service.events;

import com.phillippitts.sttguard.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log output for data-channel incidents. Decode failures are throttled
 * per remote host and error kind to avoid log spam from a misbehaving client.
 *
 * <p>Throttle entries expire after {@link #THROTTLE}; at most {@link #MAX_TRACKED_KEYS}
 * are held at once. When the table is full, new keys are logged without being tracked.
 */
@Component
class IntegrityEventsListener {
    private static final Logger LOG = LogManager.getLogger(IntegrityEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);
    static final int MAX_TRACKED_KEYS = 1024;
    private static final int MAX_DETAIL_CHARS = 200;

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onConnectionRejected(ConnectionRejectedEvent e) {
        LOG.error("Rejected client {} for data corruption: failures={}, threshold={}, last={}",
                e.clientId(), e.failureCount(), e.threshold(), e.detail());
    }

    @EventListener
    void onFrameDropped(FrameDroppedEvent e) {
        String key = hostOf(e.clientId()) + '-' + e.error();
        if (shouldLog(key, Instant.now())) {
            LOG.warn("Dropped undecodable frame from {}: error={}, size={}, head={}, detail={}",
                    e.clientId(), e.error(), e.frameSize(), e.head(),
                    LogSanitizer.truncate(e.detail(), MAX_DETAIL_CHARS));
        }
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastLog.get(key);
        if (prev != null && !isExpired(prev, now)) {
            return false;
        }
        if (prev == null && lastLog.size() >= MAX_TRACKED_KEYS) {
            lastLog.values().removeIf(t -> isExpired(t, now));
            if (lastLog.size() >= MAX_TRACKED_KEYS) {
                return true;
            }
        }
        lastLog.put(key, now);
        return true;
    }

    int trackedKeys() {
        return lastLog.size();
    }

    /** Strips the ephemeral port from a {@code host:port} client id. */
    static String hostOf(String clientId) {
        if (clientId == null) {
            return "";
        }
        int colon = clientId.lastIndexOf(':');
        if (colon <= 0 || colon == clientId.length() - 1) {
            return clientId;
        }
        for (int i = colon + 1; i < clientId.length(); i++) {
            if (!Character.isDigit(clientId.charAt(i))) {
                return clientId;
            }
        }
        return clientId.substring(0, colon);
    }

    private static boolean isExpired(Instant logged, Instant now) {
        return Duration.between(logged, now).compareTo(THROTTLE) > 0;
    }
}
