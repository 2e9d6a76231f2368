package com.aadhaar.verifier.model;

/**
 * Expected identity values supplied by the caller. Missing values are held as empty strings.
 */
public record ReferenceRecord(String name, String dob, String idNumber) {

    public ReferenceRecord {
        name = name == null ? "" : name;
        dob = dob == null ? "" : dob;
        idNumber = idNumber == null ? "" : idNumber;
    }
}
