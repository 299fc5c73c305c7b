package com.taxana.domain;

/**
 * Tier of the price waterfall that produced a USD quote. Order of preference: CACHE &gt; PRIMARY &gt; SECONDARY &gt; NONE.
 */
public enum PriceSource {
    CACHE,
    PRIMARY,
    SECONDARY,
    NONE
}
