package com.phillippitts.sttguard.service.protocol;

/**
 * Client-declared metadata carried in front of every audio payload.
 *
 * <p>{@code dataLength} and {@code checksum} are {@code null} when the client did not
 * send them; the decoder guarantees both are present whenever
 * {@code verificationRequested} is true.
 *
 * @param sampleRate sample rate in Hz (informational)
 * @param dataLength declared sample count, or {@code null}
 * @param checksum declared sum of samples modulo 2^32, or {@code null}
 * @param timestamp client send time in epoch millis (informational), or {@code null}
 * @param verificationRequested whether the client opted this frame into verification
 */
public record FrameMetadata(
        long sampleRate,
        Long dataLength,
        Long checksum,
        Long timestamp,
        boolean verificationRequested
) {

    /**
     * Metadata for a frame that asks the server to verify {@code dataLength} and {@code checksum}.
     */
    public static FrameMetadata verified(long sampleRate, long dataLength, long checksum, long timestamp) {
        return new FrameMetadata(sampleRate, dataLength, checksum, timestamp, true);
    }

    /**
     * Metadata for a frame that carries no verification data.
     */
    public static FrameMetadata unverified(long sampleRate) {
        return new FrameMetadata(sampleRate, null, null, null, false);
    }
}
