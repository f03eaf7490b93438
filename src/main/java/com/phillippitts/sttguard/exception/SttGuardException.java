package com.phillippitts.sttguard.exception;

/**
 * Base exception for all stt-guard application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SttGuardException extends RuntimeException {

    public SttGuardException(String message) {
        super(message);
    }

    public SttGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public SttGuardException(Throwable cause) {
        super(cause);
    }
}
