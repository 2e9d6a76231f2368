package com.aadhaar.verifier.service;

import com.aadhaar.verifier.model.VerificationReport;

/**
 * Report of a document image verification together with the OCR output it was computed from.
 */
public record DocumentVerification(VerificationReport report, String ocrText, double ocrConfidence) {
}
