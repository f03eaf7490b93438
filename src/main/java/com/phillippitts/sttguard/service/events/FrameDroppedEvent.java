package com.phillippitts.sttguard.service.events;

import com.phillippitts.sttguard.service.protocol.DecodeError;

import java.time.Instant;

/**
 * Published when an inbound message cannot be decoded and is dropped.
 *
 * <p>Carries no audio; {@code head} is a short hex preview of the first bytes.
 */
public record FrameDroppedEvent(
        String clientId,
        DecodeError error,
        String detail,
        int frameSize,
        String head,
        Instant at
) {}
