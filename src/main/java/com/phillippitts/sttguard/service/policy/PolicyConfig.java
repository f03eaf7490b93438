package com.phillippitts.sttguard.service.policy;

import com.phillippitts.sttguard.config.properties.IntegrityProperties;

/**
 * Process-wide integrity policy, fixed at startup and shared read-only by every connection.
 *
 * @param verifyEnabled verify frames that request it
 * @param rejectEnabled close connections whose failures exceed the threshold
 * @param corruptionThreshold failures tolerated before rejection; 0 rejects on the first failure
 * @param extendedLogging log every verdict instead of failures only
 */
public record PolicyConfig(
        boolean verifyEnabled,
        boolean rejectEnabled,
        int corruptionThreshold,
        boolean extendedLogging
) {

    public PolicyConfig {
        if (corruptionThreshold < 0) {
            throw new IllegalArgumentException("corruptionThreshold must be >= 0, got " + corruptionThreshold);
        }
    }

    /** Verification off, rejection off. */
    public static PolicyConfig disabled() {
        return new PolicyConfig(false, false, 0, false);
    }

    /** Verify and reject once more than {@code threshold} failures have been seen. */
    public static PolicyConfig rejecting(int threshold) {
        return new PolicyConfig(true, true, threshold, false);
    }

    /** Verify and warn, never reject. */
    public static PolicyConfig monitoring() {
        return new PolicyConfig(true, false, 0, false);
    }

    public static PolicyConfig from(IntegrityProperties props) {
        return new PolicyConfig(
                props.isVerifyEnabled(),
                props.isRejectEnabled(),
                props.getCorruptionThreshold(),
                props.isExtendedLogging());
    }
}
