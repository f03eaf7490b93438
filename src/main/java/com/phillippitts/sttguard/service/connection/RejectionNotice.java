package com.phillippitts.sttguard.service.connection;

import com.phillippitts.sttguard.service.integrity.VerificationVerdict;
import com.phillippitts.sttguard.service.policy.PolicyConfig;
import org.json.JSONObject;

/**
 * Structured notice sent to a client right before the server closes its connection for
 * repeated data corruption.
 *
 * <pre>
 * {"type":"error","error":"data_corruption","message":"...","action":"disconnect"}
 * </pre>
 */
public record RejectionNotice(String message) {

    public static final String TYPE = "error";
    public static final String ERROR = "data_corruption";
    public static final String ACTION = "disconnect";

    public static RejectionNotice of(ConnectionState state, VerificationVerdict verdict, PolicyConfig policy) {
        return new RejectionNotice("Data integrity verification failed "
                + state.getFailureCount() + " time(s), exceeding corruption threshold "
                + policy.corruptionThreshold() + ": " + verdict.describe());
    }

    public String toJson() {
        return new JSONObject()
                .put("type", TYPE)
                .put("error", ERROR)
                .put("message", message)
                .put("action", ACTION)
                .toString();
    }
}
