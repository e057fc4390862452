package com.tfbuilder.tfbuilder_backend.model.dto;

import java.util.Collections;
import java.util.List;

/** Request body for POST /api/terraform/parse and /api/workspace/load. */
public record ParseRequest(List<String> documents) {
    public List<String> documents() {
        return documents != null ? documents : Collections.emptyList();
    }
}
