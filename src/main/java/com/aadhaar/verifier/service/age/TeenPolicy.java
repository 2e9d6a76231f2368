package com.aadhaar.verifier.service.age;

/**
 * Age band, in whole years and inclusive on both ends, that counts as a teen.
 */
public enum TeenPolicy {

    TEEN_BAND(13, 19),
    UNDER_EIGHTEEN(0, 17);

    private final int minYears;
    private final int maxYears;

    TeenPolicy(int minYears, int maxYears) {
        this.minYears = minYears;
        this.maxYears = maxYears;
    }

    public boolean isTeen(int years) {
        return years >= minYears && years <= maxYears;
    }
}
