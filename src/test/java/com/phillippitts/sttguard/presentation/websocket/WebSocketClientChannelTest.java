package com.phillippitts.sttguard.presentation.websocket;

import com.phillippitts.sttguard.service.connection.ClientChannel;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketClientChannelTest {

    @Test
    void sendsTextWhileOpen() throws IOException {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);

        new WebSocketClientChannel(session).sendText("{\"type\":\"error\"}");

        verify(session).sendMessage(new TextMessage("{\"type\":\"error\"}"));
    }

    @Test
    void skipsClosedSession() throws IOException {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(false);
        WebSocketClientChannel channel = new WebSocketClientChannel(session);

        channel.sendText("x");
        channel.close(ClientChannel.CloseReason.POLICY_VIOLATION);

        verify(session, never()).sendMessage(any());
        verify(session, never()).close(any());
    }

    @Test
    void mapsCloseReasonsToWebSocketCodes() {
        assertThat(WebSocketClientChannel.toStatus(ClientChannel.CloseReason.POLICY_VIOLATION).getCode())
                .isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
        assertThat(WebSocketClientChannel.toStatus(ClientChannel.CloseReason.BAD_DATA).getCode())
                .isEqualTo(CloseStatus.BAD_DATA.getCode());
    }
}
