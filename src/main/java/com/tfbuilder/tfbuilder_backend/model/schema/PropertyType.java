package com.tfbuilder.tfbuilder_backend.model.schema;

public enum PropertyType {
    STRING,
    NUMBER,
    BOOLEAN,
    ENUM,
    ARRAY,
    MAP,
    SET,
    JSON,   // policy documents, rendered through jsonencode
    BLOCK   // nested block type
}
