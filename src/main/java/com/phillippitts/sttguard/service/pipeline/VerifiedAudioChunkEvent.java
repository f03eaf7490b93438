package com.phillippitts.sttguard.service.pipeline;

import java.time.Instant;

/**
 * Emitted for every audio chunk forwarded to recognition.
 *
 * @param clientId client the chunk came from
 * @param pcm PCM16 LE samples
 * @param sampleRate sample rate declared by the client
 * @param receivedAt when the server accepted the chunk
 */
public record VerifiedAudioChunkEvent(
        String clientId,
        byte[] pcm,
        long sampleRate,
        Instant receivedAt
) {}
