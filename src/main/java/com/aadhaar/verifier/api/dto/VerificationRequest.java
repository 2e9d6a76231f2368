package com.aadhaar.verifier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

public record VerificationRequest(
        @Schema(description = "Text recognized on the document", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        String rawText,
        @Schema(description = "Values the document is expected to carry", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @Valid
        ReferencePayload reference,
        @Schema(description = "Date the age is computed at, defaults to today", example = "2023-08-20")
        LocalDate asOf) {
}
