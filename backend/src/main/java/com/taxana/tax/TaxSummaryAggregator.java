package com.taxana.tax;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Running totals of one calculation run. Not thread-safe; owned by the run.
 */
public class TaxSummaryAggregator {

    private final List<TransactionTaxResult> results = new ArrayList<>();
    private final Map<TaxCategory, BigDecimal> taxes = new EnumMap<>(TaxCategory.class);
    private int acquisitions;
    private int disposals;
    private int exempt;
    private BigDecimal acquisitionValueLocal = BigDecimal.ZERO;
    private BigDecimal disposalValueLocal = BigDecimal.ZERO;
    private BigDecimal gainLocal = BigDecimal.ZERO;
    private BigDecimal lossLocal = BigDecimal.ZERO;

    public void add(TransactionTaxResult result) {
        results.add(result);
        switch (result.getClassification()) {
            case ACQUISITION -> {
                acquisitions++;
                acquisitionValueLocal = acquisitionValueLocal.add(result.getTransactionValueLocal());
            }
            case DISPOSAL -> {
                disposals++;
                disposalValueLocal = disposalValueLocal.add(result.getTransactionValueLocal());
                BigDecimal gl = result.getGainLossLocal();
                if (gl.signum() > 0) {
                    gainLocal = gainLocal.add(gl);
                } else {
                    lossLocal = lossLocal.add(gl.abs());
                }
            }
            case EXEMPT -> exempt++;
        }
        result.getTaxes().forEach((category, amount) -> taxes.merge(category, amount, BigDecimal::add));
    }

    public TaxSummary toSummary(String localCurrency, BigDecimal fxRate) {
        return TaxSummary.builder()
                .totalTransactions(results.size())
                .totalAcquisitions(acquisitions)
                .totalDisposals(disposals)
                .totalExempt(exempt)
                .totalAcquisitionValueLocal(acquisitionValueLocal)
                .totalDisposalValueLocal(disposalValueLocal)
                .totalGainLocal(gainLocal)
                .totalLossLocal(lossLocal)
                .taxes(taxes)
                .localCurrency(localCurrency)
                .fxRate(fxRate)
                .transactions(results)
                .build();
    }
}
