package com.phillippitts.sttguard.service.integrity;

/**
 * Outcome of comparing declared against computed length and checksum for one frame.
 * Created per frame and consumed immediately.
 *
 * @param lengthExpected sample count declared by the client
 * @param lengthActual sample count found in the payload
 * @param checksumExpected checksum declared by the client
 * @param checksumActual checksum computed by the server
 */
public record VerificationVerdict(
        long lengthExpected,
        long lengthActual,
        long checksumExpected,
        long checksumActual
) {

    /** True iff both length and checksum match. */
    public boolean ok() {
        return lengthMatches() && checksumMatches();
    }

    public boolean lengthMatches() {
        return lengthExpected == lengthActual;
    }

    public boolean checksumMatches() {
        return checksumExpected == checksumActual;
    }

    /**
     * Human-readable comparison, e.g. {@code "checksum expected 10, got 11; length expected 4, got 4"}.
     */
    public String describe() {
        return "checksum expected " + checksumExpected + ", got " + checksumActual
                + "; length expected " + lengthExpected + ", got " + lengthActual;
    }
}
