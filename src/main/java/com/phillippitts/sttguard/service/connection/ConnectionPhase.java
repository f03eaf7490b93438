package com.phillippitts.sttguard.service.connection;

/**
 * Lifecycle of one data-channel connection.
 *
 * <pre>
 * ACTIVE → REJECTED      (failure count exceeded the threshold)
 * ACTIVE → DISCONNECTED  (transport closed)
 * </pre>
 */
public enum ConnectionPhase {
    ACTIVE,
    REJECTED,
    DISCONNECTED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
