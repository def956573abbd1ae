package com.phillippitts.speakstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for all three run modes (server, client, batch).
 *
 * <p>The mode is chosen through the active Spring profile. The server is the default;
 * {@code --spring.profiles.active=client} starts the console recorder and
 * {@code --spring.profiles.active=batch} runs the file transcriber. Client and batch
 * profiles disable the embedded web server.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SpeakStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakStreamApplication.class, args);
    }

}
