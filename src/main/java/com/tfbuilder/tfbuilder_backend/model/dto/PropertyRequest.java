package com.tfbuilder.tfbuilder_backend.model.dto;

public record PropertyRequest(String value) {}
