package com.taxana.tax;

/**
 * Shape of a swap relative to the configured base tokens.
 */
public enum SwapType {
    /** base → token: opens a lot for the received token. */
    ACQUISITION,
    /** token → base: consumes lots of the given token. */
    DISPOSAL,
    /** token → token: disposal of the from leg, then a lot for the to leg at the disposal proceeds. */
    TOKEN_SWAP,
    /** base → base. */
    BASE_SWAP
}
