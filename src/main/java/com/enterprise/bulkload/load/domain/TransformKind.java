package com.enterprise.bulkload.load.domain;

/**
 * Normalization applied to a resolved value before it is bound.
 */
public enum TransformKind {
    NONE,
    TRIM,
    UPPER,
    LOWER,
    /** null for blank text and for "NA" / "N/A", any case. */
    NULL_IF_BLANK,
    /** 1 for true, numeric 1 or "true"; 0 for anything else. */
    BOOLEAN_01,
    NUMBER,
    STRING
}
