package com.phillippitts.speakstream.batch;

import com.phillippitts.speakstream.config.properties.BatchProperties;
import com.phillippitts.speakstream.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.CommandLineRunner;

import java.nio.file.Path;

/**
 * Runs a batch transcription once at startup in the {@code batch} profile.
 */
public class BatchRunner implements CommandLineRunner {

    private static final Logger LOG = LogManager.getLogger(BatchRunner.class);

    private final BatchTranscriptionService service;
    private final BatchProperties props;

    public BatchRunner(BatchTranscriptionService service, BatchProperties props) {
        this.service = service;
        this.props = props;
    }

    @Override
    public void run(String... args) {
        if (props.input() == null || props.input().isBlank()) {
            throw new ConfigurationException("speakstream.batch.input is required in batch mode");
        }
        BatchTranscriptionService.BatchSummary summary =
                service.run(Path.of(props.input()), Path.of(props.output()));
        LOG.info("Batch finished: {}/{} files transcribed", summary.processed(), summary.found());
    }
}
