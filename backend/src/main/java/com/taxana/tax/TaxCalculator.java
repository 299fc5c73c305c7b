package com.taxana.tax;

import com.taxana.common.SolanaTokens;
import com.taxana.costbasis.ledger.LotConsumption;
import com.taxana.costbasis.ledger.LotLedger;
import com.taxana.domain.InvalidSwapRecordException;
import com.taxana.domain.SwapRecord;
import com.taxana.fx.FxRateResolver;
import com.taxana.pricing.PriceQuote;
import com.taxana.pricing.TokenPriceResolver;
import com.taxana.tax.config.BaseSwapTreatment;
import com.taxana.tax.config.TaxProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes realised gains and DEX swap taxes for one wallet and period with FIFO lots.
 * <p>
 * Records are processed in ascending timestamp order (input order among equal timestamps). The lot ledger is
 * rebuilt on every call, so repeated calls with the same records and a stable price cache give the same summary.
 * Prices of all distinct tokens are resolved once per run at the clock's current instant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaxCalculator {

    private static final String UNKNOWN_VENUE = "unknown";

    private final TokenPriceResolver tokenPriceResolver;
    private final FxRateResolver fxRateResolver;
    private final SwapClassifier swapClassifier;
    private final TaxProperties taxProperties;
    private final Clock clock;

    /**
     * @throws InvalidSwapRecordException if any record is null or breaks an input invariant; nothing is
     *                                     calculated in that case
     */
    public TaxSummary calculateTaxes(List<SwapRecord> records) {
        if (records == null || records.isEmpty()) {
            return TaxSummary.empty(fxRateResolver.localCurrency());
        }
        for (int i = 0; i < records.size(); i++) {
            SwapRecord record = records.get(i);
            if (record == null) {
                throw new InvalidSwapRecordException(null, InvalidSwapRecordException.NULL_RECORD,
                        "Swap record at index " + i + " is null");
            }
            record.validate();
        }

        String currency = fxRateResolver.localCurrency();
        BigDecimal fxRate = fxRateResolver.usdToLocalRate();

        Set<String> tokens = new LinkedHashSet<>();
        for (SwapRecord r : records) {
            tokens.add(r.getFromToken());
            tokens.add(r.getToToken());
        }
        Map<String, PriceQuote> prices = tokenPriceResolver.resolvePrices(tokens, Instant.now(clock));

        List<SwapRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(SwapRecord::getTimestamp));

        log.info("Calculating taxes for {} swaps, {} tokens, USD/{} {}", ordered.size(), tokens.size(),
                currency, fxRate);
        RunContext run = new RunContext(prices, fxRate, currency, new LotLedger(taxProperties.getScale()));
        TaxSummaryAggregator aggregator = new TaxSummaryAggregator();
        for (SwapRecord record : ordered) {
            aggregator.add(process(record, run));
        }
        TaxSummary summary = aggregator.toSummary(currency, fxRate);
        log.info("Tax run done: {} acquisitions, {} disposals, net {} {}, total tax {} {}",
                summary.getTotalAcquisitions(), summary.getTotalDisposals(),
                summary.getNetGainLossLocal(), currency, summary.getTotalTax(), currency);
        return summary;
    }

    private TransactionTaxResult process(SwapRecord record, RunContext run) {
        PriceQuote fromQuote = run.quote(record.getFromToken());
        PriceQuote toQuote = run.quote(record.getToToken());
        BigDecimal valueUsd = record.getToAmount().multiply(toQuote.priceOrZero());
        BigDecimal valueLocal = valueUsd.multiply(run.fxRate);

        SwapType type = swapClassifier.classify(record);
        log.debug("Swap {} at {} classified {}", record.getSignature(), record.getTimestamp(), type);

        TransactionTaxResult.TransactionTaxResultBuilder result = TransactionTaxResult.builder()
                .signature(record.getSignature())
                .timestamp(record.getTimestamp())
                .swapType(type)
                .venue(record.getVenue() == null || record.getVenue().isBlank() ? UNKNOWN_VENUE : record.getVenue())
                .fromToken(record.getFromToken())
                .fromSymbol(SolanaTokens.displaySymbol(record.getFromToken(), record.getFromSymbol()))
                .fromAmount(record.getFromAmount())
                .toToken(record.getToToken())
                .toSymbol(SolanaTokens.displaySymbol(record.getToToken(), record.getToSymbol()))
                .toAmount(record.getToAmount())
                .fromPriceUsd(fromQuote.getPriceUsd().orElse(null))
                .fromPriceSource(fromQuote.getSource())
                .toPriceUsd(toQuote.getPriceUsd().orElse(null))
                .toPriceSource(toQuote.getSource())
                .fxRate(run.fxRate)
                .localCurrency(run.currency)
                .transactionValueUsd(valueUsd)
                .transactionValueLocal(valueLocal);

        Map<TaxCategory, BigDecimal> taxes = new EnumMap<>(TaxCategory.class);
        switch (type) {
            case ACQUISITION -> {
                BigDecimal costUsd = record.getFromAmount().multiply(fromQuote.priceOrZero());
                run.ledger.recordAcquisition(record.getToToken(), record.getToAmount(),
                        costUsd, costUsd.multiply(run.fxRate), record.getTimestamp());
                taxes.put(TaxCategory.PURCHASE, valueLocal.multiply(taxProperties.getPurchaseTaxRate()));
                result.classification(TaxClassification.ACQUISITION);
            }
            case DISPOSAL -> dispose(record, record.getFromAmount().multiply(fromQuote.priceOrZero()),
                    valueLocal, run, result, taxes);
            case TOKEN_SWAP -> {
                dispose(record, valueUsd, valueLocal, run, result, taxes);
                run.ledger.recordAcquisition(record.getToToken(), record.getToAmount(),
                        valueUsd, valueLocal, record.getTimestamp());
            }
            case BASE_SWAP -> {
                if (taxProperties.getBaseSwapTreatment() == BaseSwapTreatment.EXEMPT) {
                    result.classification(TaxClassification.EXEMPT);
                } else {
                    dispose(record, record.getFromAmount().multiply(fromQuote.priceOrZero()),
                            valueLocal, run, result, taxes);
                }
            }
        }
        return result.taxes(taxes).build();
    }

    /** Consumes the from leg's lots and taxes the swap value as a sale. */
    private void dispose(SwapRecord record, BigDecimal proceedsUsd, BigDecimal valueLocal, RunContext run,
                         TransactionTaxResult.TransactionTaxResultBuilder result, Map<TaxCategory, BigDecimal> taxes) {
        LotConsumption consumed = run.ledger.consume(record.getFromToken(), record.getFromAmount());
        if (!consumed.isFullyMatched() && !swapClassifier.isBaseToken(record.getFromToken())) {
            log.warn("Swap {} disposes {} {} beyond tracked lots; {} carries zero cost basis",
                    record.getSignature(), record.getFromAmount(), record.getFromToken(),
                    consumed.getAmountUnmatched());
        }
        BigDecimal gainUsd = proceedsUsd.subtract(consumed.getCostBasisUsd());
        taxes.put(TaxCategory.SALE, valueLocal.multiply(taxProperties.getSaleTaxRate()));
        result.classification(TaxClassification.DISPOSAL)
                .costBasisUsd(consumed.getCostBasisUsd())
                .costBasisLocal(consumed.getCostBasisLocal())
                .gainLossUsd(gainUsd)
                .gainLossLocal(gainUsd.multiply(run.fxRate))
                .amountUnmatched(consumed.getAmountUnmatched());
    }

    private static final class RunContext {
        private final Map<String, PriceQuote> prices;
        private final BigDecimal fxRate;
        private final String currency;
        private final LotLedger ledger;

        private RunContext(Map<String, PriceQuote> prices, BigDecimal fxRate, String currency, LotLedger ledger) {
            this.prices = prices;
            this.fxRate = fxRate;
            this.currency = currency;
            this.ledger = ledger;
        }

        private PriceQuote quote(String token) {
            return prices.getOrDefault(token, PriceQuote.none());
        }
    }
}
