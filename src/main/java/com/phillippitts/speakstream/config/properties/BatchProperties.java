package com.phillippitts.speakstream.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Input and output locations for batch transcription.
 *
 * @param input  audio file or directory to transcribe (required in batch mode)
 * @param output directory receiving one {@code <name>_result.json} per input file
 */
@ConfigurationProperties(prefix = "speakstream.batch")
@Validated
public record BatchProperties(
        String input,

        @NotBlank(message = "Batch output directory must not be blank")
        String output
) {
    public BatchProperties {
        if (output == null || output.isBlank()) {
            output = "results";
        }
    }
}
