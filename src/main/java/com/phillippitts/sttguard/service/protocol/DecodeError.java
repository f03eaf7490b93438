package com.phillippitts.sttguard.service.protocol;

/**
 * Reasons a data-channel message cannot be decoded.
 */
public enum DecodeError {
    /** Fewer than 4 prefix bytes, or fewer metadata bytes than the prefix declares. */
    TRUNCATED,
    /** Metadata is not UTF-8, not a JSON object, or has fields of the wrong type. */
    MALFORMED_METADATA,
    /** Payload byte count is odd, so it cannot hold whole 16-bit samples. */
    MISALIGNED_PAYLOAD
}
