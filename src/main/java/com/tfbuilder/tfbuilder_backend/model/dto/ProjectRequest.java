package com.tfbuilder.tfbuilder_backend.model.dto;

public record ProjectRequest(String name, String description) {}
