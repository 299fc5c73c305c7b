package com.taxana.tax;

import com.taxana.domain.PriceSource;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tax outcome of one swap. Local amounts use the run's single USD rate. Prices are null when the leg could not
 * be priced; such a leg is valued at zero.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TransactionTaxResult {

    private final String signature;
    private final Instant timestamp;
    private final TaxClassification classification;
    private final SwapType swapType;
    private final String venue;

    private final String fromToken;
    private final String fromSymbol;
    private final BigDecimal fromAmount;
    private final String toToken;
    private final String toSymbol;
    private final BigDecimal toAmount;

    private final BigDecimal fromPriceUsd;
    private final PriceSource fromPriceSource;
    private final BigDecimal toPriceUsd;
    private final PriceSource toPriceSource;
    private final BigDecimal fxRate;
    private final String localCurrency;

    /** Value of the received leg: toAmount × toPrice. */
    private final BigDecimal transactionValueUsd;
    private final BigDecimal transactionValueLocal;

    private final BigDecimal costBasisUsd;
    private final BigDecimal costBasisLocal;
    private final BigDecimal gainLossUsd;
    private final BigDecimal gainLossLocal;
    /** Disposed amount not covered by tracked lots (zero cost basis). */
    private final BigDecimal amountUnmatched;

    private final Map<TaxCategory, BigDecimal> taxes;
    private final BigDecimal totalTax;

    @Builder
    private TransactionTaxResult(String signature, Instant timestamp, TaxClassification classification,
                                 SwapType swapType, String venue,
                                 String fromToken, String fromSymbol, BigDecimal fromAmount,
                                 String toToken, String toSymbol, BigDecimal toAmount,
                                 BigDecimal fromPriceUsd, PriceSource fromPriceSource,
                                 BigDecimal toPriceUsd, PriceSource toPriceSource,
                                 BigDecimal fxRate, String localCurrency,
                                 BigDecimal transactionValueUsd, BigDecimal transactionValueLocal,
                                 BigDecimal costBasisUsd, BigDecimal costBasisLocal,
                                 BigDecimal gainLossUsd, BigDecimal gainLossLocal,
                                 BigDecimal amountUnmatched, Map<TaxCategory, BigDecimal> taxes) {
        this.signature = signature;
        this.timestamp = timestamp;
        this.classification = classification;
        this.swapType = swapType;
        this.venue = venue;
        this.fromToken = fromToken;
        this.fromSymbol = fromSymbol;
        this.fromAmount = fromAmount;
        this.toToken = toToken;
        this.toSymbol = toSymbol;
        this.toAmount = toAmount;
        this.fromPriceUsd = fromPriceUsd;
        this.fromPriceSource = fromPriceSource;
        this.toPriceUsd = toPriceUsd;
        this.toPriceSource = toPriceSource;
        this.fxRate = fxRate;
        this.localCurrency = localCurrency;
        this.transactionValueUsd = orZero(transactionValueUsd);
        this.transactionValueLocal = orZero(transactionValueLocal);
        this.costBasisUsd = orZero(costBasisUsd);
        this.costBasisLocal = orZero(costBasisLocal);
        this.gainLossUsd = orZero(gainLossUsd);
        this.gainLossLocal = orZero(gainLossLocal);
        this.amountUnmatched = orZero(amountUnmatched);
        EnumMap<TaxCategory, BigDecimal> copy = new EnumMap<>(TaxCategory.class);
        for (TaxCategory category : TaxCategory.values()) {
            copy.put(category, taxes == null ? BigDecimal.ZERO : orZero(taxes.get(category)));
        }
        this.taxes = Collections.unmodifiableMap(copy);
        this.totalTax = copy.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTax(TaxCategory category) {
        return taxes.get(category);
    }

    private static BigDecimal orZero(BigDecimal v) {
        return v != null ? v : BigDecimal.ZERO;
    }
}
