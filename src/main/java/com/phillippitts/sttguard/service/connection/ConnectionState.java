package com.phillippitts.sttguard.service.connection;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-connection integrity bookkeeping.
 *
 * <p>Owned exclusively by the worker handling the connection; frames of one connection
 * are processed strictly in arrival order, so no locking is needed here. The failure
 * count only grows: passing frames never reset it.
 */
public final class ConnectionState {

    private final String clientId;
    private final Instant createdAt;

    private ConnectionPhase phase = ConnectionPhase.ACTIVE;
    private int failureCount;

    private long framesReceived;
    private long framesVerified;
    private long decodeErrors;

    public ConnectionState(String clientId, Instant createdAt) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public ConnectionState(String clientId) {
        this(clientId, Instant.now());
    }

    public String getClientId() {
        return clientId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ConnectionPhase getPhase() {
        return phase;
    }

    public boolean isActive() {
        return phase == ConnectionPhase.ACTIVE;
    }

    /** Cumulative failing verdicts for the lifetime of the connection. */
    public int getFailureCount() {
        return failureCount;
    }

    public long getFramesReceived() {
        return framesReceived;
    }

    public long getFramesVerified() {
        return framesVerified;
    }

    public long getDecodeErrors() {
        return decodeErrors;
    }

    void frameReceived() {
        framesReceived++;
    }

    void frameVerified() {
        framesVerified++;
    }

    void decodeFailed() {
        decodeErrors++;
    }

    int recordFailure() {
        return ++failureCount;
    }

    void markRejected() {
        phase = ConnectionPhase.REJECTED;
    }

    /**
     * Moves an active connection to {@link ConnectionPhase#DISCONNECTED}.
     * A rejected connection keeps its terminal phase.
     */
    void markDisconnected() {
        if (phase == ConnectionPhase.ACTIVE) {
            phase = ConnectionPhase.DISCONNECTED;
        }
    }

    @Override
    public String toString() {
        return "ConnectionState{clientId=" + clientId
                + ", phase=" + phase
                + ", failureCount=" + failureCount
                + ", framesReceived=" + framesReceived
                + ", framesVerified=" + framesVerified
                + ", decodeErrors=" + decodeErrors + '}';
    }
}
