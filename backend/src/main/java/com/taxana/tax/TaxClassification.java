package com.taxana.tax;

public enum TaxClassification {
    ACQUISITION,
    DISPOSAL,
    EXEMPT
}
