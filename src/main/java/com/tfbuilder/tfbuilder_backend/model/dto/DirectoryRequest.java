package com.tfbuilder.tfbuilder_backend.model.dto;

public record DirectoryRequest(String path) {}
