package com.tfbuilder.tfbuilder_backend.model.dto;

/** Position update uses x/y; size update uses width/height. */
public record GeometryRequest(
    Double x,
    Double y,
    Double width,
    Double height
) {}
