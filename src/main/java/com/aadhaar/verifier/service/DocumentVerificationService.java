package com.aadhaar.verifier.service;

import com.aadhaar.verifier.model.ReferenceRecord;
import com.aadhaar.verifier.model.VerificationReport;
import com.aadhaar.verifier.service.ocr.TesseractOcrEngine;
import com.aadhaar.verifier.service.ocr.TesseractOcrEngine.OcrResult;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DocumentVerificationService {

    private static final Logger log = LoggerFactory.getLogger(DocumentVerificationService.class);

    private final TesseractOcrEngine ocrEngine;
    private final VerificationEngine verificationEngine;

    public DocumentVerificationService(TesseractOcrEngine ocrEngine, VerificationEngine verificationEngine) {
        this.ocrEngine = ocrEngine;
        this.verificationEngine = verificationEngine;
    }

    /**
     * Recognizes the document text and verifies it. A document without readable text still yields a
     * report, with every field absent.
     *
     * @param asOf date the age is computed at, today when {@code null}
     */
    public DocumentVerification verify(byte[] image, ReferenceRecord reference, LocalDate asOf) {
        Optional<OcrResult> recognized = ocrEngine.recognize(image);
        if (recognized.isEmpty()) {
            log.warn("No text recognized in the submitted document");
        }
        String text = recognized.map(OcrResult::text).orElse("");
        double confidence = recognized.map(OcrResult::confidence).orElse(0.0);
        log.debug("Recognized text with confidence {}:\n{}", confidence, text);
        VerificationReport report = asOf == null
                ? verificationEngine.verify(text, reference)
                : verificationEngine.verify(text, reference, asOf);
        return new DocumentVerification(report, text, confidence);
    }
}
