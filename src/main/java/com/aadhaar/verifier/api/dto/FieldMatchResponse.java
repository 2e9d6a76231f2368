package com.aadhaar.verifier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record FieldMatchResponse(
        @Schema(description = "Whether the extracted value matches the expected one")
        boolean matched,
        @Schema(description = "Similarity in [0,1]; exact fields report 1 or 0")
        double similarity,
        @Schema(description = "Value found on the document, absent when not found")
        String extracted,
        @Schema(description = "Value supplied by the caller")
        String expected) {
}
