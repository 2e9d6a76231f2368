package com.aadhaar.verifier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record VerificationResponse(
        @Schema(description = "True when name, date of birth and Aadhaar number all match")
        boolean allMatch,
        FieldMatchResponse name,
        FieldMatchResponse dob,
        FieldMatchResponse idNumber,
        ExtractedDetails extracted,
        @Schema(description = "Age in whole years from the extracted date of birth")
        Integer age,
        @Schema(description = "Teen classification under the configured policy")
        Boolean teen,
        @Schema(description = "Mean OCR word confidence, only for document uploads")
        Double ocrConfidence,
        @Schema(description = "Text recognized on the uploaded image, only for document uploads")
        String ocrText,
        @Schema(description = "Plain-text summary of the verification")
        String summary) {
}
