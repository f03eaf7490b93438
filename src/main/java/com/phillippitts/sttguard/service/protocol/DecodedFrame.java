package com.phillippitts.sttguard.service.protocol;

import java.util.Objects;

/**
 * Result of a successful {@link FrameCodec#decode(byte[])}.
 *
 * @param metadata parsed metadata
 * @param payload raw little-endian PCM16 bytes, even length
 */
public record DecodedFrame(FrameMetadata metadata, byte[] payload) {

    public DecodedFrame {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(payload, "payload");
    }

    /** Number of 16-bit samples in the payload. */
    public int sampleCount() {
        return payload.length / FrameCodec.BYTES_PER_SAMPLE;
    }
}
