package com.taxana.costbasis.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of consuming lots for one disposal. {@code amountUnmatched} is the part of the request no lot
 * covered; it carries zero cost basis.
 */
@Getter
@RequiredArgsConstructor
public class LotConsumption {

    private final BigDecimal costBasisUsd;
    private final BigDecimal costBasisLocal;
    private final BigDecimal amountMatched;
    private final BigDecimal amountUnmatched;

    public static LotConsumption none(BigDecimal requested) {
        return new LotConsumption(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, requested);
    }

    public boolean isFullyMatched() {
        return amountUnmatched.signum() == 0;
    }
}
