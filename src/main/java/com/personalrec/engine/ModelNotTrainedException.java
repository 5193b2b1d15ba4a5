package com.personalrec.engine;

/**
 * Thrown when recommendations are requested before any embedding table has been built.
 */
public class ModelNotTrainedException extends IllegalStateException {
    public ModelNotTrainedException(String message) {
        super(message);
    }
}
