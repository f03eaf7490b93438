package com.phillippitts.sttguard.service.pipeline;

import com.phillippitts.sttguard.service.protocol.DecodedFrame;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Default {@link AudioChunkConsumer}: republishes chunks as {@link VerifiedAudioChunkEvent}
 * so recognition components can subscribe with {@code @EventListener}.
 */
@Component
public class EventPublishingAudioChunkConsumer implements AudioChunkConsumer {

    private final ApplicationEventPublisher publisher;

    public EventPublishingAudioChunkConsumer(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void accept(String clientId, DecodedFrame frame) {
        publisher.publishEvent(new VerifiedAudioChunkEvent(
                clientId, frame.payload(), frame.metadata().sampleRate(), Instant.now()));
    }
}
