package com.phillippitts.sttguard.presentation.websocket;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;
import java.util.UUID;

/**
 * Assigns each data-channel connection a correlation id for structured logging.
 *
 * <p>Uses the {@code X-Request-ID} handshake header when present, otherwise a random UUID.
 * The id is stored in the session attributes and copied into Log4j2's ThreadContext by
 * {@link AudioDataWebSocketHandler} while frames are processed.
 */
public class ConnectionIdHandshakeInterceptor implements HandshakeInterceptor {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CONNECTION_ID_ATTRIBUTE = "connectionId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String v = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        attributes.put(CONNECTION_ID_ATTRIBUTE,
                (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to clean up
    }
}
