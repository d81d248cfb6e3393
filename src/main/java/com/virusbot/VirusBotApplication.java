package com.virusbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point of the VirusBot game client.
 * <p>
 * Connects to a game server over WebSocket, joins or creates a lobby, accepts challenges
 * and plays its turns with the configured strategy (heuristic or Monte Carlo tree search).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VirusBotApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(VirusBotApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }
}
