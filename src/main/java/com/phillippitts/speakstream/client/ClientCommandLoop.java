package com.phillippitts.speakstream.client;

import com.phillippitts.speakstream.config.properties.ClientProperties;
import com.phillippitts.speakstream.exception.ConfigurationException;
import com.phillippitts.speakstream.exception.ConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Console front end of the client: connects, then maps {@code s} to start/stop and
 * {@code q} to quit. End of input quits as well.
 */
@Component
@Profile("client")
public class ClientCommandLoop implements CommandLineRunner {

    private static final Logger LOG = LogManager.getLogger(ClientCommandLoop.class);

    private final StreamingAsrClient client;
    private final RecordingController controller;
    private final TranscriptConsole console;
    private final ClientProperties props;
    private final InputStream input;

    @Autowired
    public ClientCommandLoop(StreamingAsrClient client, RecordingController controller,
                             TranscriptConsole console, ClientProperties props) {
        this(client, controller, console, props, System.in);
    }

    ClientCommandLoop(StreamingAsrClient client, RecordingController controller,
                      TranscriptConsole console, ClientProperties props, InputStream input) {
        this.client = client;
        this.controller = controller;
        this.console = console;
        this.props = props;
        this.input = input;
    }

    @Override
    public void run(String... args) throws IOException {
        URI serverUri = parseServerUri(props.getServerUrl());
        console.printBanner(serverUri.toString());
        try {
            client.connect(serverUri, Duration.ofMillis(props.getConnectTimeoutMs()));
        } catch (ConnectionException e) {
            throw new ConfigurationException("Cannot reach server at " + serverUri + ": " + e.getMessage(), e);
        }
        controller.open();
        try {
            if (props.isAutoStart()) {
                controller.start();
            }
            commandLoop();
        } finally {
            controller.close();
            client.close();
        }
    }

    private void commandLoop() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        while (true) {
            console.prompt();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            if (client.closeFuture().isDone()) {
                console.notice("Server closed the connection");
                return;
            }
            String command = line.trim().toLowerCase(Locale.ROOT);
            switch (command) {
                case "s":
                    controller.toggle();
                    break;
                case "q":
                    LOG.info("Quit requested");
                    return;
                case "":
                    break;
                default:
                    console.notice("Unknown command '" + command + "'");
            }
        }
        LOG.debug("Input closed, exiting");
    }

    static URI parseServerUri(String serverUrl) {
        try {
            URI uri = URI.create(serverUrl.trim());
            String scheme = uri.getScheme();
            if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
                throw new ConfigurationException("Server URL must use ws:// or wss://: " + serverUrl);
            }
            if (uri.getHost() == null) {
                throw new ConfigurationException("Server URL has no host: " + serverUrl);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid server URL: " + serverUrl, e);
        }
    }
}
