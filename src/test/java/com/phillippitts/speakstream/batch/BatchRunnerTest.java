package com.phillippitts.speakstream.batch;

import com.phillippitts.speakstream.config.properties.BatchProperties;
import com.phillippitts.speakstream.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchRunnerTest {

    @Test
    void missingInputPropertyIsFatal() {
        BatchRunner runner = new BatchRunner(mock(BatchTranscriptionService.class), new BatchProperties(null, null));

        assertThatThrownBy(runner::run)
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getExitCode()).isEqualTo(2));
    }

    @Test
    void runsWithDefaultOutputDirectory() {
        BatchTranscriptionService service = mock(BatchTranscriptionService.class);
        when(service.run(Path.of("audio"), Path.of("results")))
                .thenReturn(new BatchTranscriptionService.BatchSummary(1, 1));

        new BatchRunner(service, new BatchProperties("audio", null)).run();

        verify(service).run(Path.of("audio"), Path.of("results"));
    }
}
