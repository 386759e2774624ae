package com.sedmap.model;

/** How negative flux or variance values are replaced after masking. */
public enum CleaningMethod {
    ZERO,
    /** Negative pixels are set to the minimum non negative flux of the band. */
    MIN
}
