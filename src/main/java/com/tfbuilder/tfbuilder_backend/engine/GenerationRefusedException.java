package com.tfbuilder.tfbuilder_backend.engine;

/** Generation was not attempted, e.g. because there is nothing to generate. */
public class GenerationRefusedException extends RuntimeException {

    public GenerationRefusedException(String message) {
        super(message);
    }
}
