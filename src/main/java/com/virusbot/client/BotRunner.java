package com.virusbot.client;

import com.virusbot.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Connects on startup and keeps the application alive until the server closes the
 * connection. Disabled with {@code virusbot.auto-connect=false}.
 */
@Component
@ConditionalOnProperty(prefix = "virusbot", name = "auto-connect", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BotRunner implements CommandLineRunner {

    private final GameServerClient client;
    private final BotProperties properties;

    @Override
    public void run(String... args) throws InterruptedException {
        log.info("Starting {} ({} strategy)", properties.getName(), properties.getStrategy());
        client.connect();
        client.awaitClose();
        log.info("Connection closed, shutting down");
    }
}
