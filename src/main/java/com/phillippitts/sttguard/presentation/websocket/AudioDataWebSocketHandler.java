package com.phillippitts.sttguard.presentation.websocket;

import com.phillippitts.sttguard.config.properties.IntegrityProperties;
import com.phillippitts.sttguard.service.connection.AudioDataService;
import com.phillippitts.sttguard.service.connection.ConnectionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.BinaryWebSocketHandler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

/**
 * WebSocket adapter for the audio data channel.
 *
 * <p>Each session owns one {@link ConnectionState}, kept in the session attributes from
 * handshake to close. The container delivers messages of a session one at a time, which
 * gives the in-order, single-worker processing {@link AudioDataService} requires.
 * Frames that arrive after a rejection are ignored.
 */
@Component
public class AudioDataWebSocketHandler extends BinaryWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(AudioDataWebSocketHandler.class);

    static final String STATE_ATTRIBUTE = ConnectionState.class.getName();

    private final AudioDataService service;
    private final int maxFrameBytes;

    public AudioDataWebSocketHandler(AudioDataService service, IntegrityProperties props) {
        this.service = service;
        this.maxFrameBytes = props.getMaxFrameBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        session.setBinaryMessageSizeLimit(maxFrameBytes);
        String clientId = clientId(session);
        withLogContext(session, clientId, () ->
                session.getAttributes().put(STATE_ATTRIBUTE, service.open(clientId)));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ConnectionState state = (ConnectionState) session.getAttributes().get(STATE_ATTRIBUTE);
        if (state == null || !state.isActive()) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);

        withLogContext(session, state.getClientId(),
                () -> service.onMessage(state, bytes, new WebSocketClientChannel(session)));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        LOG.warn("Transport error on data connection {}: {}", clientId(session), exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionState state = (ConnectionState) session.getAttributes().remove(STATE_ATTRIBUTE);
        if (state != null) {
            withLogContext(session, state.getClientId(), () -> service.onClose(state));
        }
    }

    static String clientId(WebSocketSession session) {
        InetSocketAddress remote = session.getRemoteAddress();
        if (remote == null) {
            return session.getId();
        }
        return remote.getHostString() + ":" + remote.getPort();
    }

    private static void withLogContext(WebSocketSession session, String clientId, Runnable action) {
        try {
            Object connectionId = session.getAttributes().get(ConnectionIdHandshakeInterceptor.CONNECTION_ID_ATTRIBUTE);
            if (connectionId != null) {
                ThreadContext.put("connectionId", connectionId.toString());
            }
            ThreadContext.put("clientId", clientId);
            action.run();
        } finally {
            ThreadContext.clearAll();
        }
    }
}
