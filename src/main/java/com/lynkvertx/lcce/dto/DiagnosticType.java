package com.lynkvertx.lcce.dto;

/**
 * Kinds of non-fatal problems recorded during a calculation.
 */
public enum DiagnosticType {
    /** A reference table key is absent; the contribution defaults to zero */
    LOOKUP_MISS,
    /** A denominator was not positive and has been replaced with 1 */
    DIVISION_GUARD,
    /** A required configuration record is absent; the pair is skipped */
    CONFIG_MISSING,
    /** A table entry uses a pricing unit the engine cannot apply */
    UNSUPPORTED_UNIT,
    /** Unexpected failure inside a cost component; its contribution is zero */
    COMPUTATION_EXCEPTION
}
