package com.taxana.tax;

/**
 * Tax heads charged on swaps, in local currency.
 */
public enum TaxCategory {
    /** Final income tax on disposals (PPh). */
    SALE,
    /** VAT on acquisitions (PPN). */
    PURCHASE
}
