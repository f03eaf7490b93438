package com.phillippitts.sttguard.service.connection;

import com.phillippitts.sttguard.service.integrity.VerificationVerdict;
import com.phillippitts.sttguard.service.protocol.DecodeError;

/**
 * What happened to one inbound message.
 *
 * @param action action taken, or {@code null} when the frame was dropped undecoded
 * @param verdict verdict, or {@code null} when verification was skipped or decoding failed
 * @param decodeError decode failure, or {@code null} when the frame decoded
 */
public record FrameOutcome(FrameAction action, VerificationVerdict verdict, DecodeError decodeError) {

    static FrameOutcome dropped(DecodeError error) {
        return new FrameOutcome(null, null, error);
    }

    static FrameOutcome handled(FrameAction action, VerificationVerdict verdict) {
        return new FrameOutcome(action, verdict, null);
    }

    public boolean isDropped() {
        return decodeError != null;
    }
}
