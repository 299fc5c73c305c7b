package com.taxana.costbasis.ledger;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Acquired quantity of one token with its remaining cost basis in USD and local currency.
 * Owned by a single {@link LotLedger}; only the ledger shrinks it.
 */
@Getter
public class Lot {

    private final String token;
    private final Instant acquiredAt;
    private BigDecimal amount;
    private BigDecimal costBasisUsd;
    private BigDecimal costBasisLocal;

    Lot(String token, BigDecimal amount, BigDecimal costBasisUsd, BigDecimal costBasisLocal, Instant acquiredAt) {
        this.token = token;
        this.amount = amount;
        this.costBasisUsd = costBasisUsd;
        this.costBasisLocal = costBasisLocal;
        this.acquiredAt = acquiredAt;
    }

    /** Average cost per unit in USD; zero for an empty lot. */
    public BigDecimal unitCostUsd(int scale) {
        if (amount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return costBasisUsd.divide(amount, scale, RoundingMode.HALF_UP);
    }

    Lot copy() {
        return new Lot(token, amount, costBasisUsd, costBasisLocal, acquiredAt);
    }

    /**
     * Takes {@code part} (strictly less than amount) out of this lot. Both cost bases shrink by the same
     * fraction part / amount, so the unit cost is unchanged.
     *
     * @return cost basis taken as {usd, local}
     */
    BigDecimal[] split(BigDecimal part, int scale) {
        BigDecimal takenUsd = costBasisUsd.multiply(part).divide(amount, scale, RoundingMode.HALF_UP);
        BigDecimal takenLocal = costBasisLocal.multiply(part).divide(amount, scale, RoundingMode.HALF_UP);
        amount = amount.subtract(part);
        costBasisUsd = costBasisUsd.subtract(takenUsd);
        costBasisLocal = costBasisLocal.subtract(takenLocal);
        return new BigDecimal[] { takenUsd, takenLocal };
    }
}
