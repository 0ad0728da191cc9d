package com.pinebridge.convert;

/**
 * What the caller should do with a script after the complexity gate.
 */
public enum Recommendation {
    USE_RULE_BASED,
    USE_FALLBACK_CONVERTER,
    MANUAL_REVIEW
}
