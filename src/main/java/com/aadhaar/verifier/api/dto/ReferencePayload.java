package com.aadhaar.verifier.api.dto;

import com.aadhaar.verifier.model.ReferenceRecord;
import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;

public record ReferencePayload(
        @Schema(description = "Expected name of the card holder", example = "John Doe")
        String name,
        @Schema(description = "Expected date of birth in any supported form", example = "15/08/1995")
        String dob,
        @Schema(description = "Expected Aadhaar number, separators allowed", example = "1234 5678 9012")
        @JsonAlias("aadhaar")
        String idNumber) {

    public ReferenceRecord toRecord() {
        return new ReferenceRecord(name, dob, idNumber);
    }
}
