package com.taxana.tax;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Totals of one calculation run in local currency, with the per-swap results in processing order.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TaxSummary {

    private final int totalTransactions;
    private final int totalAcquisitions;
    private final int totalDisposals;
    private final int totalExempt;

    private final BigDecimal totalAcquisitionValueLocal;
    private final BigDecimal totalDisposalValueLocal;

    /** Sum of positive realised gains. */
    private final BigDecimal totalGainLocal;
    /** Sum of realised losses as a positive magnitude. */
    private final BigDecimal totalLossLocal;
    private final BigDecimal netGainLossLocal;

    private final Map<TaxCategory, BigDecimal> taxes;
    private final BigDecimal totalTax;

    private final String localCurrency;
    /** Null for an empty run (no rate was fetched). */
    private final BigDecimal fxRate;

    private final List<TransactionTaxResult> transactions;

    @Builder
    private TaxSummary(int totalTransactions, int totalAcquisitions, int totalDisposals, int totalExempt,
                       BigDecimal totalAcquisitionValueLocal, BigDecimal totalDisposalValueLocal,
                       BigDecimal totalGainLocal, BigDecimal totalLossLocal,
                       Map<TaxCategory, BigDecimal> taxes, String localCurrency, BigDecimal fxRate,
                       List<TransactionTaxResult> transactions) {
        this.totalTransactions = totalTransactions;
        this.totalAcquisitions = totalAcquisitions;
        this.totalDisposals = totalDisposals;
        this.totalExempt = totalExempt;
        this.totalAcquisitionValueLocal = orZero(totalAcquisitionValueLocal);
        this.totalDisposalValueLocal = orZero(totalDisposalValueLocal);
        this.totalGainLocal = orZero(totalGainLocal);
        this.totalLossLocal = orZero(totalLossLocal);
        this.netGainLossLocal = this.totalGainLocal.subtract(this.totalLossLocal);
        EnumMap<TaxCategory, BigDecimal> copy = new EnumMap<>(TaxCategory.class);
        for (TaxCategory category : TaxCategory.values()) {
            copy.put(category, taxes == null ? BigDecimal.ZERO : orZero(taxes.get(category)));
        }
        this.taxes = Collections.unmodifiableMap(copy);
        this.totalTax = copy.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        this.localCurrency = localCurrency;
        this.fxRate = fxRate;
        this.transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public static TaxSummary empty(String localCurrency) {
        return TaxSummary.builder().localCurrency(localCurrency).build();
    }

    public BigDecimal getTax(TaxCategory category) {
        return taxes.get(category);
    }

    private static BigDecimal orZero(BigDecimal v) {
        return v != null ? v : BigDecimal.ZERO;
    }
}
