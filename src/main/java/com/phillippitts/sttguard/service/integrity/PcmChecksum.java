package com.phillippitts.sttguard.service.integrity;

import com.phillippitts.sttguard.service.protocol.FrameCodec;

/**
 * Checksum shared by streaming clients and the server: the sum of all signed 16-bit
 * little-endian samples, reduced modulo 2^32 only after the last sample.
 *
 * <p>Samples contribute their signed value, so negative samples lower the running sum.
 * This mirrors the client's {@code int64} accumulation exactly; changing it breaks wire
 * compatibility. The sum is a transmission-error detector, not a digest: mutations whose
 * sample deltas cancel out are not detected.
 */
public final class PcmChecksum {

    private static final long UINT32_MASK = 0xFFFF_FFFFL;

    private PcmChecksum() {}

    /**
     * @param pcm little-endian PCM16 bytes; a trailing odd byte is ignored
     * @return checksum in the range 0..2^32-1
     */
    public static long compute(byte[] pcm) {
        long sum = 0;
        for (int i = 0; i + 1 < pcm.length; i += FrameCodec.BYTES_PER_SAMPLE) {
            sum += readSample(pcm, i);
        }
        return sum & UINT32_MASK;
    }

    /**
     * @param pcm little-endian PCM16 bytes
     * @return number of whole samples
     */
    public static int sampleCount(byte[] pcm) {
        return pcm.length / FrameCodec.BYTES_PER_SAMPLE;
    }

    static short readSample(byte[] a, int off) {
        return (short) ((a[off] & 0xFF) | (a[off + 1] << 8));
    }
}
