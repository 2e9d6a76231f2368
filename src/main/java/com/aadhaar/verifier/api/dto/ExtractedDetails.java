package com.aadhaar.verifier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record ExtractedDetails(
        @Schema(description = "Upper-cased name found on the document")
        String name,
        @Schema(description = "Date of birth as dd-MM-yyyy")
        String dob,
        @Schema(description = "Twelve digit Aadhaar number without separators")
        String idNumber) {
}
