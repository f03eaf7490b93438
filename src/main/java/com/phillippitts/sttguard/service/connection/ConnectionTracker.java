package com.phillippitts.sttguard.service.connection;

import com.phillippitts.sttguard.service.integrity.VerificationVerdict;
import com.phillippitts.sttguard.service.policy.PolicyConfig;
import org.springframework.stereotype.Component;

/**
 * Decides, per frame, whether a connection keeps streaming.
 *
 * <p><b>Transition rules</b>, evaluated in order:
 * <ol>
 *   <li>No verdict (verification skipped) → {@link FrameAction#ACCEPT}</li>
 *   <li>Passing verdict → {@link FrameAction#ACCEPT}; the failure count is left as is</li>
 *   <li>Failing verdict → failure count + 1, then
 *     <ul>
 *       <li>rejection disabled → {@link FrameAction#ACCEPT_WITH_WARNING}</li>
 *       <li>count &lt;= threshold → {@link FrameAction#ACCEPT_WITH_WARNING}</li>
 *       <li>count &gt; threshold → {@link FrameAction#REJECT}, state moves to
 *           {@link ConnectionPhase#REJECTED}</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>The tracker itself holds no state; every call operates on the {@link ConnectionState}
 * owned by the calling connection, so one instance serves all connections.
 */
@Component
public class ConnectionTracker {

    /**
     * @param state the connection's own state; must be {@link ConnectionPhase#ACTIVE}
     * @param verdict verdict for the frame, or {@code null} when verification was skipped
     * @param policy active policy
     * @return action the caller must carry out
     * @throws IllegalStateException if the connection already reached a terminal phase
     */
    public FrameAction onVerdict(ConnectionState state, VerificationVerdict verdict, PolicyConfig policy) {
        if (!state.isActive()) {
            throw new IllegalStateException("Connection " + state.getClientId()
                    + " is " + state.getPhase() + " and accepts no more frames");
        }
        if (verdict == null) {
            return FrameAction.ACCEPT;
        }
        state.frameVerified();
        if (verdict.ok()) {
            return FrameAction.ACCEPT;
        }

        int failures = state.recordFailure();
        if (!policy.rejectEnabled() || failures <= policy.corruptionThreshold()) {
            return FrameAction.ACCEPT_WITH_WARNING;
        }
        state.markRejected();
        return FrameAction.REJECT;
    }

    /**
     * Records a frame that could not be decoded. Never touches the failure count.
     */
    public void onDecodeError(ConnectionState state) {
        state.decodeFailed();
    }

    /**
     * Records receipt of a frame before it is decoded.
     */
    public void onFrameReceived(ConnectionState state) {
        state.frameReceived();
    }

    /**
     * Signals that the transport closed. Safe to call at any time, including after rejection.
     */
    public void onClose(ConnectionState state) {
        state.markDisconnected();
    }
}
