package com.phillippitts.sttguard.config;

import com.phillippitts.sttguard.config.properties.IntegrityProperties;
import com.phillippitts.sttguard.presentation.websocket.AudioDataWebSocketHandler;
import com.phillippitts.sttguard.presentation.websocket.ConnectionIdHandshakeInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the audio data channel at {@code stt.integrity.data-path}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AudioDataWebSocketHandler handler;
    private final IntegrityProperties props;

    public WebSocketConfig(AudioDataWebSocketHandler handler, IntegrityProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, props.getDataPath())
                .addInterceptors(new ConnectionIdHandshakeInterceptor());
    }
}
