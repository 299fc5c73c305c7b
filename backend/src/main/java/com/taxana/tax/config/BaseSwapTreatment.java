package com.taxana.tax.config;

/**
 * How a swap between two base tokens (e.g. SOL → USDC) is taxed.
 */
public enum BaseSwapTreatment {
    /** Taxed like any disposal of the from leg. */
    DISPOSAL,
    /** Reported with zero tax and left out of acquisition/disposal totals. */
    EXEMPT
}
