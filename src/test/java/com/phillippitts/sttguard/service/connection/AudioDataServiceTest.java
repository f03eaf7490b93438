package com.phillippitts.sttguard.service.connection;

import com.phillippitts.sttguard.config.properties.IntegrityProperties;
import com.phillippitts.sttguard.service.events.ConnectionRejectedEvent;
import com.phillippitts.sttguard.service.events.FrameDroppedEvent;
import com.phillippitts.sttguard.service.integrity.IntegrityVerifier;
import com.phillippitts.sttguard.service.metrics.IntegrityMetrics;
import com.phillippitts.sttguard.service.pipeline.AudioChunkConsumer;
import com.phillippitts.sttguard.service.policy.PolicyConfig;
import com.phillippitts.sttguard.service.protocol.DecodeError;
import com.phillippitts.sttguard.service.protocol.DecodedFrame;
import com.phillippitts.sttguard.service.protocol.FrameCodec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import static com.phillippitts.sttguard.testutil.PcmFixtures.frame;
import static com.phillippitts.sttguard.testutil.PcmFixtures.pcm;
import static com.phillippitts.sttguard.testutil.PcmFixtures.rawFrame;
import static com.phillippitts.sttguard.testutil.PcmFixtures.tone;
import static com.phillippitts.sttguard.testutil.PcmFixtures.validFrame;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AudioDataServiceTest {

    private static final String CLIENT = "192.168.1.20:40000";

    private AudioChunkConsumer consumer;
    private ApplicationEventPublisher publisher;
    private MeterRegistry registry;
    private RecordingClientChannel channel;

    @BeforeEach
    void setUp() {
        consumer = mock(AudioChunkConsumer.class);
        publisher = mock(ApplicationEventPublisher.class);
        registry = new SimpleMeterRegistry();
        channel = new RecordingClientChannel();
    }

    @Test
    void matchingFrameIsForwarded() {
        AudioDataService service = service(PolicyConfig.rejecting(0), false);
        ConnectionState state = service.open(CLIENT);

        FrameOutcome outcome = service.onMessage(state, frame(pcm(1, 2, 3, 4), 4, 10), channel);

        assertThat(outcome.action()).isEqualTo(FrameAction.ACCEPT);
        assertThat(outcome.verdict().ok()).isTrue();
        verify(consumer).accept(eq(CLIENT), any(DecodedFrame.class));
        assertThat(channel.sent()).isEmpty();
        assertThat(channel.isClosed()).isFalse();
        assertThat(passCount()).isEqualTo(1.0);
    }

    @Test
    void corruptedFrameInMonitorModeIsForwardedWithWarning() {
        AudioDataService service = service(PolicyConfig.monitoring(), false);
        ConnectionState state = service.open(CLIENT);

        FrameOutcome outcome = service.onMessage(state, frame(pcm(1, 2, 3, 5), 4, 10), channel);

        assertThat(outcome.action()).isEqualTo(FrameAction.ACCEPT_WITH_WARNING);
        assertThat(outcome.verdict().checksumActual()).isEqualTo(11);
        verify(consumer).accept(eq(CLIENT), any(DecodedFrame.class));
        assertThat(channel.isClosed()).isFalse();
        assertThat(state.getFailureCount()).isEqualTo(1);
    }

    @Test
    void corruptedFrameWithStrictPolicyRejectsConnection() {
        AudioDataService service = service(PolicyConfig.rejecting(0), false);
        ConnectionState state = service.open(CLIENT);

        FrameOutcome outcome = service.onMessage(state, frame(pcm(1, 2, 3, 5), 4, 10), channel);

        assertThat(outcome.action()).isEqualTo(FrameAction.REJECT);
        verify(consumer, never()).accept(any(), any());
        assertThat(channel.sent()).hasSize(1);
        JSONObject notice = new JSONObject(channel.sent().get(0));
        assertThat(notice.getString("type")).isEqualTo("error");
        assertThat(notice.getString("error")).isEqualTo("data_corruption");
        assertThat(notice.getString("action")).isEqualTo("disconnect");
        assertThat(notice.getString("message")).contains("expected 10", "got 11");
        assertThat(channel.closeReason()).isEqualTo(ClientChannel.CloseReason.POLICY_VIOLATION);
        assertThat(state.getPhase()).isEqualTo(ConnectionPhase.REJECTED);

        ArgumentCaptor<ConnectionRejectedEvent> event = ArgumentCaptor.forClass(ConnectionRejectedEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertThat(event.getValue().clientId()).isEqualTo(CLIENT);
        assertThat(event.getValue().failureCount()).isEqualTo(1);
        assertThat(registry.get("sttguard.integrity.rejections").counter().count()).isEqualTo(1.0);
    }

    @Test
    void toleratedFailuresPrecedeRejection() {
        AudioDataService service = service(PolicyConfig.rejecting(2), false);
        ConnectionState state = service.open(CLIENT);
        byte[] corrupted = frame(tone(200), 3200, 12345);

        assertThat(service.onMessage(state, corrupted, channel).action()).isEqualTo(FrameAction.ACCEPT_WITH_WARNING);
        assertThat(service.onMessage(state, validFrame(tone(100)), channel).action()).isEqualTo(FrameAction.ACCEPT);
        assertThat(service.onMessage(state, corrupted, channel).action()).isEqualTo(FrameAction.ACCEPT_WITH_WARNING);
        assertThat(channel.isClosed()).isFalse();
        assertThat(service.onMessage(state, corrupted, channel).action()).isEqualTo(FrameAction.REJECT);

        assertThat(channel.isClosed()).isTrue();
        verify(consumer, times(3)).accept(eq(CLIENT), any(DecodedFrame.class));
    }

    @Test
    void framesAfterRejectionAreRefused() {
        AudioDataService service = service(PolicyConfig.rejecting(0), false);
        ConnectionState state = service.open(CLIENT);
        service.onMessage(state, frame(pcm(1), 1, 2), channel);

        assertThatThrownBy(() -> service.onMessage(state, validFrame(pcm(1)), channel))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void verificationDisabledForwardsEverything() {
        AudioDataService service = service(PolicyConfig.disabled(), false);
        ConnectionState state = service.open(CLIENT);

        FrameOutcome outcome = service.onMessage(state, frame(pcm(1, 2, 3, 5), 4, 10), channel);

        assertThat(outcome.action()).isEqualTo(FrameAction.ACCEPT);
        assertThat(outcome.verdict()).isNull();
        assertThat(registry.get("sttguard.integrity.skipped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void oddPayloadIsDroppedWithoutVerdict() {
        AudioDataService service = service(PolicyConfig.rejecting(0), false);
        ConnectionState state = service.open(CLIENT);

        FrameOutcome outcome = service.onMessage(state,
                rawFrame("{\"sampleRate\":16000}", new byte[]{1, 2, 3}), channel);

        assertThat(outcome.isDropped()).isTrue();
        assertThat(outcome.decodeError()).isEqualTo(DecodeError.MISALIGNED_PAYLOAD);
        assertThat(outcome.verdict()).isNull();
        assertThat(state.getFailureCount()).isZero();
        assertThat(state.getDecodeErrors()).isEqualTo(1);
        assertThat(state.isActive()).isTrue();
        assertThat(channel.isClosed()).isFalse();
        verify(consumer, never()).accept(any(), any());
        verify(publisher).publishEvent(any(FrameDroppedEvent.class));
    }

    @Test
    void decodeErrorClosesConnectionWhenConfigured() {
        AudioDataService service = service(PolicyConfig.rejecting(0), true);
        ConnectionState state = service.open(CLIENT);

        service.onMessage(state, new byte[]{9, 0}, channel);

        assertThat(channel.closeReason()).isEqualTo(ClientChannel.CloseReason.BAD_DATA);
        assertThat(channel.sent()).isEmpty();
        assertThat(state.getFailureCount()).isZero();
    }

    @Test
    void rejectionStillClosesWhenNoticeCannotBeSent() {
        AudioDataService service = service(PolicyConfig.rejecting(0), false);
        ConnectionState state = service.open(CLIENT);
        channel.failSends();

        service.onMessage(state, frame(pcm(1), 1, 2), channel);

        assertThat(channel.closeReason()).isEqualTo(ClientChannel.CloseReason.POLICY_VIOLATION);
    }

    @Test
    void closeRecordsDisconnect() {
        AudioDataService service = service(PolicyConfig.rejecting(0), false);
        ConnectionState state = service.open(CLIENT);
        service.onMessage(state, validFrame(pcm(3, 4)), channel);

        service.onClose(state);

        assertThat(state.getPhase()).isEqualTo(ConnectionPhase.DISCONNECTED);
        assertThat(state.getFramesReceived()).isEqualTo(1);
        assertThat(registry.get("sttguard.integrity.connections").tag("event", "closed").counter().count())
                .isEqualTo(1.0);
    }

    private double passCount() {
        return registry.get("sttguard.integrity.verdicts").tag("result", "pass").counter().count();
    }

    private AudioDataService service(PolicyConfig policy, boolean closeOnDecodeError) {
        IntegrityProperties props = new IntegrityProperties(
                policy.verifyEnabled(), policy.rejectEnabled(), policy.corruptionThreshold(),
                policy.extendedLogging(), closeOnDecodeError, null, null);
        return new AudioDataService(new FrameCodec(), new IntegrityVerifier(), new ConnectionTracker(),
                consumer, policy, props, new IntegrityMetrics(registry), publisher);
    }
}
