package com.virusbot.client;

import com.virusbot.config.BotProperties;
import com.virusbot.exception.ProtocolException;
import com.virusbot.exception.TransportException;
import com.virusbot.protocol.MessageCodec;
import com.virusbot.protocol.OutboundMessage;
import com.virusbot.protocol.ServerMessage;
import com.virusbot.session.GameChannel;
import com.virusbot.session.GameSessionService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WebSocket connection to the game server. Incoming text frames are decoded and handed
 * to {@link GameSessionService}; outgoing commands go through {@link #send}.
 */
@Component
@Slf4j
public class GameServerClient extends TextWebSocketHandler implements GameChannel {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final WebSocketClient webSocketClient;
    private final MessageCodec codec;
    private final GameSessionService sessionService;
    private final BotProperties properties;

    private final CountDownLatch closed = new CountDownLatch(1);
    private volatile WebSocketSession session;

    public GameServerClient(WebSocketClient webSocketClient, MessageCodec codec,
                            GameSessionService sessionService, BotProperties properties) {
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.sessionService = sessionService;
        this.properties = properties;
    }

    /**
     * Open the connection, waiting at most {@code virusbot.connect-timeout}.
     *
     * @throws TransportException if the handshake fails or times out
     */
    public void connect() {
        String url = properties.getServerUrl();
        log.info("Connecting to {}", url);
        try {
            webSocketClient.execute(this, url)
                    .get(properties.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + url, e);
        } catch (ExecutionException e) {
            throw new TransportException("Failed to connect to " + url, e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException("Timed out connecting to " + url, e);
        }
    }

    /**
     * Block until the server closes the connection.
     */
    public void awaitClose() throws InterruptedException {
        closed.await();
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocketSession) {
        session = new ConcurrentWebSocketSessionDecorator(webSocketSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        log.info("Connected to game server (session {})", webSocketSession.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) {
        log.trace("Received {}", message.getPayload());
        try {
            ServerMessage decoded = codec.decode(message.getPayload());
            sessionService.handle(decoded, this);
        } catch (ProtocolException e) {
            log.warn("Dropping malformed message: {}", e.getMessage());
        } catch (TransportException e) {
            log.warn("Could not reply to server: {}", e.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
        log.error("Transport error on session {}", webSocketSession.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
        log.info("Disconnected from server: {}", status);
        session = null;
        closed.countDown();
    }

    @Override
    public void send(OutboundMessage message) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new TransportException("Not connected, cannot send " + message.type(), null);
        }
        String payload = codec.encode(message);
        log.debug("Sending {}", payload);
        try {
            current.sendMessage(new TextMessage(payload));
        } catch (IOException e) {
            throw new TransportException("Failed to send " + message.type(), e);
        }
    }

    @PreDestroy
    public void disconnect() {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }
}
