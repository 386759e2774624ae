package com.sedmap.model;

/** Which bands decide whether a pixel ends up in the table. */
public enum ValidPixelPolicy {
    /** Finite flux and variance in the first band. Other bands are not checked. */
    FIRST_BAND,
    ALL_BANDS
}
