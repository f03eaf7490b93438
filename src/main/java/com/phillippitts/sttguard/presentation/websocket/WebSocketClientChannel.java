package com.phillippitts.sttguard.presentation.websocket;

import com.phillippitts.sttguard.service.connection.ClientChannel;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ClientChannel} backed by a Spring {@link WebSocketSession}.
 */
class WebSocketClientChannel implements ClientChannel {

    private final WebSocketSession session;

    WebSocketClientChannel(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void sendText(String text) throws IOException {
        if (session.isOpen()) {
            session.sendMessage(new TextMessage(text));
        }
    }

    @Override
    public void close(CloseReason reason) throws IOException {
        if (session.isOpen()) {
            session.close(toStatus(reason));
        }
    }

    static CloseStatus toStatus(CloseReason reason) {
        return switch (reason) {
            case POLICY_VIOLATION -> CloseStatus.POLICY_VIOLATION.withReason("data_corruption");
            case BAD_DATA -> CloseStatus.BAD_DATA.withReason("undecodable frame");
        };
    }
}
