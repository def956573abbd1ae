package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.client.RecordingController;
import com.phillippitts.speakstream.client.StreamingAsrClient;
import com.phillippitts.speakstream.client.TranscriptAggregator;
import com.phillippitts.speakstream.client.TranscriptConsole;
import com.phillippitts.speakstream.client.capture.AudioCaptureService;
import com.phillippitts.speakstream.config.properties.ClientProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Wires the console client: connection, transcript and recording controller.
 */
@Configuration
@Profile("client")
public class ClientConfig {

    @Bean
    public TranscriptAggregator transcriptAggregator() {
        return new TranscriptAggregator();
    }

    @Bean
    public TranscriptConsole transcriptConsole() {
        return new TranscriptConsole(System.out, true);
    }

    @Bean
    public HttpClient clientHttpClient(ClientProperties props) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public StreamingAsrClient streamingAsrClient(HttpClient clientHttpClient,
                                                 TranscriptAggregator aggregator,
                                                 TranscriptConsole console) {
        return new StreamingAsrClient(clientHttpClient, aggregator, console);
    }

    @Bean(destroyMethod = "close")
    public RecordingController recordingController(AudioCaptureService captureService,
                                                   StreamingAsrClient client,
                                                   TranscriptAggregator aggregator,
                                                   TranscriptConsole console,
                                                   ClientProperties props) {
        return new RecordingController(captureService, client, aggregator, console,
                props.getSampleRate(), props.getSendQueueCapacity());
    }
}
