package com.tfbuilder.tfbuilder_backend.model.domain;

public enum ConnectionPointType {
    INPUT,   // consumer side, left edge
    OUTPUT;  // provider side, right edge

    public ConnectionPointType complement() {
        return this == INPUT ? OUTPUT : INPUT;
    }
}
