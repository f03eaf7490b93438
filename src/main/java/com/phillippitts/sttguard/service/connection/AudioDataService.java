package com.phillippitts.sttguard.service.connection;

import com.phillippitts.sttguard.config.properties.IntegrityProperties;
import com.phillippitts.sttguard.exception.FrameDecodeException;
import com.phillippitts.sttguard.service.events.ConnectionRejectedEvent;
import com.phillippitts.sttguard.service.events.FrameDroppedEvent;
import com.phillippitts.sttguard.service.integrity.IntegrityVerifier;
import com.phillippitts.sttguard.service.integrity.VerificationVerdict;
import com.phillippitts.sttguard.service.metrics.IntegrityMetrics;
import com.phillippitts.sttguard.service.pipeline.AudioChunkConsumer;
import com.phillippitts.sttguard.service.policy.PolicyConfig;
import com.phillippitts.sttguard.service.protocol.DecodedFrame;
import com.phillippitts.sttguard.service.protocol.FrameCodec;
import com.phillippitts.sttguard.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Transport-agnostic handler for the audio data channel.
 *
 * <p>Inbound path for every binary message:
 * <pre>
 *   FrameCodec.decode
 *       → IntegrityVerifier (only if client and policy ask for it)
 *           → ConnectionTracker.onVerdict
 *               → forward to AudioChunkConsumer | reject and close
 * </pre>
 *
 * <p>Messages of one connection must be passed in arrival order from a single worker.
 * Different connections share nothing but the read-only {@link PolicyConfig}.
 */
@Service
public class AudioDataService {

    private static final Logger LOG = LogManager.getLogger(AudioDataService.class);
    private static final int HEAD_PREVIEW_BYTES = 16;

    private final FrameCodec codec;
    private final IntegrityVerifier verifier;
    private final ConnectionTracker tracker;
    private final AudioChunkConsumer consumer;
    private final PolicyConfig policy;
    private final boolean closeOnDecodeError;
    private final IntegrityMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public AudioDataService(FrameCodec codec,
                            IntegrityVerifier verifier,
                            ConnectionTracker tracker,
                            AudioChunkConsumer consumer,
                            PolicyConfig policy,
                            IntegrityProperties properties,
                            IntegrityMetrics metrics,
                            ApplicationEventPublisher publisher) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.closeOnDecodeError = properties.isCloseOnDecodeError();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Creates the state for a newly accepted connection.
     *
     * @param clientId opaque client identifier, e.g. {@code host:port}
     */
    public ConnectionState open(String clientId) {
        ConnectionState state = new ConnectionState(clientId);
        metrics.recordConnectionOpened();
        LOG.info("Data connection opened: client={}, verify={}, reject={}, threshold={}",
                clientId, policy.verifyEnabled(), policy.rejectEnabled(), policy.corruptionThreshold());
        return state;
    }

    /**
     * Processes one binary message.
     *
     * @param state the connection's state
     * @param message raw message bytes
     * @param channel outbound side of the same connection
     * @return what happened to the message
     * @throws IllegalStateException if the connection is no longer active
     */
    public FrameOutcome onMessage(ConnectionState state, byte[] message, ClientChannel channel) {
        if (!state.isActive()) {
            throw new IllegalStateException("Connection " + state.getClientId() + " is " + state.getPhase());
        }
        tracker.onFrameReceived(state);

        DecodedFrame frame;
        try {
            frame = codec.decode(message);
        } catch (FrameDecodeException e) {
            return dropFrame(state, message, e, channel);
        }

        VerificationVerdict verdict = verifier.verifyIfRequested(frame, policy);
        if (verdict == null) {
            metrics.incrementSkipped();
        } else {
            metrics.recordVerdict(verdict.ok());
        }

        FrameAction action = tracker.onVerdict(state, verdict, policy);
        logVerdict(state, verdict, action);

        if (action.forwardsPayload()) {
            consumer.accept(state.getClientId(), frame);
        } else {
            reject(state, verdict, channel);
        }
        return FrameOutcome.handled(action, verdict);
    }

    /**
     * Signals that the transport closed; logs a per-connection summary.
     * Safe to call after rejection.
     */
    public void onClose(ConnectionState state) {
        tracker.onClose(state);
        metrics.recordConnectionClosed();
        LOG.info("Data connection closed: client={}, phase={}, frames={}, verified={}, failures={}, "
                        + "decodeErrors={}, duration={}ms",
                state.getClientId(), state.getPhase(), state.getFramesReceived(), state.getFramesVerified(),
                state.getFailureCount(), state.getDecodeErrors(),
                Duration.between(state.getCreatedAt(), Instant.now()).toMillis());
    }

    private FrameOutcome dropFrame(ConnectionState state, byte[] message, FrameDecodeException e,
                                   ClientChannel channel) {
        tracker.onDecodeError(state);
        metrics.incrementDecodeError(e.getError());
        publisher.publishEvent(new FrameDroppedEvent(
                state.getClientId(), e.getError(), e.getMessage(), e.getFrameSize(),
                LogSanitizer.hexPreview(message, HEAD_PREVIEW_BYTES), Instant.now()));

        if (closeOnDecodeError) {
            try {
                channel.close(ClientChannel.CloseReason.BAD_DATA);
            } catch (IOException ex) {
                LOG.warn("Failed to close client {} after decode error", state.getClientId(), ex);
            }
        }
        return FrameOutcome.dropped(e.getError());
    }

    private void logVerdict(ConnectionState state, VerificationVerdict verdict, FrameAction action) {
        if (verdict == null) {
            return;
        }
        if (!verdict.ok()) {
            LOG.warn("Integrity check failed: client={}, failures={}, action={}, {}",
                    state.getClientId(), state.getFailureCount(), action, verdict.describe());
        } else if (policy.extendedLogging()) {
            LOG.info("Integrity check passed: client={}, samples={}, checksum={}",
                    state.getClientId(), verdict.lengthActual(), verdict.checksumActual());
        }
    }

    private void reject(ConnectionState state, VerificationVerdict verdict, ClientChannel channel) {
        RejectionNotice notice = RejectionNotice.of(state, verdict, policy);
        metrics.incrementRejections();
        publisher.publishEvent(new ConnectionRejectedEvent(
                state.getClientId(), state.getFailureCount(), policy.corruptionThreshold(),
                verdict.describe(), Instant.now()));
        try {
            channel.sendText(notice.toJson());
        } catch (IOException e) {
            LOG.warn("Failed to send rejection notice to {}", state.getClientId(), e);
        }
        try {
            channel.close(ClientChannel.CloseReason.POLICY_VIOLATION);
        } catch (IOException e) {
            LOG.warn("Failed to close rejected client {}", state.getClientId(), e);
        }
    }
}
