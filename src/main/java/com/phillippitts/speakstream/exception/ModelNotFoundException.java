package com.phillippitts.speakstream.exception;

/**
 * Thrown when a recognizer model cannot be found at the configured path.
 * This is a startup/configuration error and should fail fast.
 */
public class ModelNotFoundException extends ConfigurationException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Recognizer model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Recognizer model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
