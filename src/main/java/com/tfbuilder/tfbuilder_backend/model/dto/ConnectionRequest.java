package com.tfbuilder.tfbuilder_backend.model.dto;

public record ConnectionRequest(String sourceBlockId, String targetBlockId) {}
