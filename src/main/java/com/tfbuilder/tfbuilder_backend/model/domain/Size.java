package com.tfbuilder.tfbuilder_backend.model.domain;

public record Size(double width, double height) {

    public static final Size DEFAULT_BLOCK = new Size(120, 40);
}
