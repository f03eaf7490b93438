package com.phillippitts.sttguard.exception;

import com.phillippitts.sttguard.service.protocol.DecodeError;

import java.util.Objects;

/**
 * Thrown when a wire message cannot be parsed into metadata and payload.
 *
 * <p>This is a protocol-level fault, not a corruption signal: callers drop the frame
 * and must not count it against the connection's integrity failure budget.
 */
public class FrameDecodeException extends SttGuardException {

    private final DecodeError error;
    private final int frameSize;

    public FrameDecodeException(DecodeError error, int frameSize, String detail) {
        super(error + " (" + frameSize + " bytes): " + detail);
        this.error = Objects.requireNonNull(error, "error");
        this.frameSize = frameSize;
    }

    public FrameDecodeException(DecodeError error, int frameSize, String detail, Throwable cause) {
        super(error + " (" + frameSize + " bytes): " + detail, cause);
        this.error = Objects.requireNonNull(error, "error");
        this.frameSize = frameSize;
    }

    public DecodeError getError() {
        return error;
    }

    public int getFrameSize() {
        return frameSize;
    }
}
