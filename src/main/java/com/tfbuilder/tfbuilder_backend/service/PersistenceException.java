package com.tfbuilder.tfbuilder_backend.service;

import lombok.Getter;

/** A project or output file could not be read or written. */
@Getter
public class PersistenceException extends RuntimeException {

    private final String file;
    private final String operation;

    public PersistenceException(String file, String operation, Throwable cause) {
        super("Failed to " + operation + " " + file + ": " + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.file = file;
        this.operation = operation;
    }
}
