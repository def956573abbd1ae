package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.batch.AudioFileLoader;
import com.phillippitts.speakstream.batch.BatchRunner;
import com.phillippitts.speakstream.batch.BatchTranscriptionService;
import com.phillippitts.speakstream.config.properties.BatchProperties;
import com.phillippitts.speakstream.server.recognition.RecognitionDispatcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("batch")
public class BatchConfig {

    @Bean
    public AudioFileLoader audioFileLoader() {
        return new AudioFileLoader();
    }

    @Bean
    public BatchTranscriptionService batchTranscriptionService(RecognitionDispatcher dispatcher,
                                                               AudioFileLoader loader) {
        return new BatchTranscriptionService(dispatcher, loader);
    }

    @Bean
    public BatchRunner batchRunner(BatchTranscriptionService service, BatchProperties props) {
        return new BatchRunner(service, props);
    }
}
