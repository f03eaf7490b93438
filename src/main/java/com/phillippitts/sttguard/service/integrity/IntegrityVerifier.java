package com.phillippitts.sttguard.service.integrity;

import com.phillippitts.sttguard.service.policy.PolicyConfig;
import com.phillippitts.sttguard.service.protocol.DecodedFrame;
import com.phillippitts.sttguard.service.protocol.FrameMetadata;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Recomputes sample count and checksum for a payload and compares them with the values
 * the client declared.
 *
 * <p>Deterministic and side-effect free; runs in time linear in the sample count.
 */
@Component
public class IntegrityVerifier {

    /**
     * Verifies a frame if both the client and the server policy ask for it.
     *
     * @param frame decoded frame
     * @param policy active policy
     * @return the verdict, or {@code null} when verification is skipped (implicit pass)
     */
    public VerificationVerdict verifyIfRequested(DecodedFrame frame, PolicyConfig policy) {
        if (!policy.verifyEnabled() || !frame.metadata().verificationRequested()) {
            return null;
        }
        return verify(frame.metadata(), frame.payload());
    }

    /**
     * Compares declared metadata with the payload.
     *
     * @param metadata metadata with {@code dataLength} and {@code checksum} present
     * @param payload PCM16 LE bytes
     * @return verdict; {@link VerificationVerdict#ok()} is false on any mismatch
     * @throws IllegalArgumentException if the metadata carries no verification data
     */
    public VerificationVerdict verify(FrameMetadata metadata, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (metadata.dataLength() == null || metadata.checksum() == null) {
            throw new IllegalArgumentException("metadata carries no dataLength/checksum to verify");
        }
        return new VerificationVerdict(
                metadata.dataLength(),
                PcmChecksum.sampleCount(payload),
                metadata.checksum(),
                PcmChecksum.compute(payload));
    }
}
