package io.github.samzhu.modelprice.exception;

/**
 * 查無指定 ID 的定價記錄。
 */
public class ModelNotFoundException extends RuntimeException {

    private final String modelId;

    public ModelNotFoundException(String modelId) {
        super(String.format("Model not found: '%s'", modelId));
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
