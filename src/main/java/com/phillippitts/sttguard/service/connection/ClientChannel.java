package com.phillippitts.sttguard.service.connection;

import java.io.IOException;

/**
 * Outbound half of a client connection, as seen by {@link AudioDataService}.
 *
 * <p>Implementations wrap a concrete transport (WebSocket session, test double).
 * Only the worker that owns the connection calls these methods.
 */
public interface ClientChannel {

    /**
     * Sends a text message (JSON) to the client.
     */
    void sendText(String text) throws IOException;

    /**
     * Closes the connection.
     *
     * @param reason why the server closes it
     */
    void close(CloseReason reason) throws IOException;

    /**
     * Server-initiated close reasons.
     */
    enum CloseReason {
        /** Too many integrity failures. */
        POLICY_VIOLATION,
        /** Frame could not be decoded and the server is configured to drop the connection. */
        BAD_DATA
    }
}
