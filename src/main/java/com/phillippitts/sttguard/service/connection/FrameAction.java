package com.phillippitts.sttguard.service.connection;

/**
 * What the connection handler does with a frame after the tracker has seen its verdict.
 */
public enum FrameAction {
    /** Forward the payload. */
    ACCEPT,
    /** Forward the payload and log the failure; the connection stays open. */
    ACCEPT_WITH_WARNING,
    /** Send the rejection notice and close the connection; the payload is not forwarded. */
    REJECT;

    public boolean forwardsPayload() {
        return this != REJECT;
    }
}
