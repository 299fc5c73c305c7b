package com.taxana.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One parsed on-chain swap of a wallet: {@code fromAmount} of {@code fromToken} given up for {@code toAmount}
 * of {@code toToken}. Supplied by the ingestion side; never mutated by the tax engine.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class SwapRecord {

    private final String signature;
    private final Instant timestamp;
    private final String fromToken;
    private final BigDecimal fromAmount;
    private final String fromSymbol;
    private final String toToken;
    private final BigDecimal toAmount;
    private final String toSymbol;
    /** Free-text origin label, e.g. jupiter, raydium, orca. */
    private final String venue;

    /**
     * Checks the invariants the FIFO ledger depends on.
     *
     * @throws InvalidSwapRecordException on the first violated invariant
     */
    public void validate() {
        if (signature == null || signature.isBlank()) {
            throw new InvalidSwapRecordException(null, InvalidSwapRecordException.MISSING_SIGNATURE,
                    "Swap record without signature");
        }
        if (timestamp == null) {
            throw new InvalidSwapRecordException(signature, InvalidSwapRecordException.MISSING_TIMESTAMP,
                    "Swap " + signature + " has no timestamp");
        }
        if (fromToken == null || fromToken.isBlank() || toToken == null || toToken.isBlank()) {
            throw new InvalidSwapRecordException(signature, InvalidSwapRecordException.MISSING_TOKEN,
                    "Swap " + signature + " is missing a token on one leg");
        }
        requireNonNegative(fromAmount, "fromAmount");
        requireNonNegative(toAmount, "toAmount");
    }

    private void requireNonNegative(BigDecimal amount, String field) {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidSwapRecordException(signature, InvalidSwapRecordException.INVALID_AMOUNT,
                    "Swap " + signature + " has invalid " + field + ": " + amount);
        }
    }
}
