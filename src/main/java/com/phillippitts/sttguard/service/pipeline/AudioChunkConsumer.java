package com.phillippitts.sttguard.service.pipeline;

import com.phillippitts.sttguard.service.protocol.DecodedFrame;

/**
 * Downstream consumer (speech-recognition pipeline) of audio that passed the integrity gate.
 *
 * <p>Called on the connection's worker thread in arrival order. Implementations must not
 * block for long; hand off to an executor if recognition is slow.
 */
public interface AudioChunkConsumer {

    /**
     * @param clientId client the audio came from
     * @param frame decoded frame; the payload is PCM16 LE
     */
    void accept(String clientId, DecodedFrame frame);
}
