package com.aadhaar.verifier.api;

import com.aadhaar.verifier.api.dto.ExtractedDetails;
import com.aadhaar.verifier.api.dto.FieldMatchResponse;
import com.aadhaar.verifier.api.dto.VerificationRequest;
import com.aadhaar.verifier.api.dto.VerificationResponse;
import com.aadhaar.verifier.model.CanonicalDate;
import com.aadhaar.verifier.model.ExtractedFields;
import com.aadhaar.verifier.model.FieldMatch;
import com.aadhaar.verifier.model.ReferenceRecord;
import com.aadhaar.verifier.model.VerificationReport;
import com.aadhaar.verifier.service.DocumentVerification;
import com.aadhaar.verifier.service.DocumentVerificationService;
import com.aadhaar.verifier.service.VerificationEngine;
import com.aadhaar.verifier.service.report.VerificationSummaryFormatter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping(path = "/api/v1/verifications", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Aadhaar identity verification")
@Validated
public class VerificationController {

    private final VerificationEngine verificationEngine;
    private final DocumentVerificationService documentVerificationService;
    private final VerificationSummaryFormatter summaryFormatter;

    public VerificationController(VerificationEngine verificationEngine,
                                  DocumentVerificationService documentVerificationService,
                                  VerificationSummaryFormatter summaryFormatter) {
        this.verificationEngine = verificationEngine;
        this.documentVerificationService = documentVerificationService;
        this.summaryFormatter = summaryFormatter;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Verify OCR text against reference values",
            description = "Extracts name, date of birth and Aadhaar number from already recognized text",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Verification report",
                            content = @Content(schema = @Schema(implementation = VerificationResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload"),
                    @ApiResponse(responseCode = "422", description = "Reference date precedes the date of birth")
            })
    public ResponseEntity<VerificationResponse> verifyText(@Valid @RequestBody VerificationRequest request) {
        ReferenceRecord reference = request.reference().toRecord();
        VerificationReport report = request.asOf() == null
                ? verificationEngine.verify(request.rawText(), reference)
                : verificationEngine.verify(request.rawText(), reference, request.asOf());
        return ResponseEntity.ok(toResponse(report, null, null));
    }

    @PostMapping(value = "/document", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Verify an uploaded Aadhaar card image against reference values",
            description = "Runs OCR on the image, then extracts and verifies the identity fields",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Verification report",
                            content = @Content(schema = @Schema(implementation = VerificationResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Missing or unreadable image"),
                    @ApiResponse(responseCode = "422", description = "Reference date precedes the date of birth")
            })
    public ResponseEntity<VerificationResponse> verifyDocument(
            @RequestPart("image") MultipartFile image,
            @RequestParam(value = "name", defaultValue = "") String name,
            @RequestParam(value = "dob", defaultValue = "") String dob,
            @RequestParam(value = "idNumber", defaultValue = "") String idNumber,
            @RequestParam(value = "asOf", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("Uploaded image must not be empty");
        }
        try {
            DocumentVerification verification = documentVerificationService.verify(
                    image.getBytes(), new ReferenceRecord(name, dob, idNumber), asOf);
            return ResponseEntity.ok(toResponse(verification.report(), verification.ocrConfidence(),
                    verification.ocrText()));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read uploaded image", ex);
        }
    }

    VerificationResponse toResponse(VerificationReport report, Double ocrConfidence, String ocrText) {
        ExtractedFields extracted = report.extracted();
        return new VerificationResponse(
                report.allMatch(),
                toResponse(report.name()),
                toResponse(report.dob()),
                toResponse(report.idNumber()),
                new ExtractedDetails(
                        extracted.name().orElse(null),
                        extracted.dob().map(CanonicalDate::format).orElse(null),
                        extracted.idNumber().orElse(null)),
                report.ageYears().isPresent() ? report.ageYears().getAsInt() : null,
                report.isTeen().orElse(null),
                ocrConfidence,
                ocrText,
                summaryFormatter.format(report));
    }

    private static FieldMatchResponse toResponse(FieldMatch match) {
        return new FieldMatchResponse(
                match.matched(),
                match.similarityScore(),
                match.extractedValue().orElse(null),
                match.expectedValue());
    }
}
