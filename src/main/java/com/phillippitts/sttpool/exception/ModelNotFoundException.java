package com.phillippitts.sttpool.exception;

/**
 * The model directory a work function needs is missing. Raised from worker initialization, so the
 * worker exits with its init-failure code before ever reporting ready.
 */
public class ModelNotFoundException extends SttPoolException {

    private final String engineName;
    private final String modelPath;

    public ModelNotFoundException(String engineName, String modelPath) {
        super(engineName + " model not found at path: " + modelPath);
        this.engineName = engineName;
        this.modelPath = modelPath;
    }

    public String getEngineName() {
        return engineName;
    }

    public String getModelPath() {
        return modelPath;
    }
}
