package com.taxana.costbasis.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-token FIFO queues of acquisition lots for one calculation run.
 * <p>
 * Lots are appended at the tail in acquiredAt order and consumed from the head; a partially consumed head lot
 * keeps its unit cost. The ledger is built from scratch for every run and is not thread-safe: it belongs to the
 * single classification loop that owns the run.
 */
@Slf4j
public class LotLedger {

    public static final int DEFAULT_SCALE = 18;

    private final int scale;
    private final Map<String, Deque<Lot>> lotsByToken = new HashMap<>();
    private final Map<String, BigDecimal> acquiredByToken = new HashMap<>();
    private final Map<String, BigDecimal> consumedByToken = new HashMap<>();

    public LotLedger() {
        this(DEFAULT_SCALE);
    }

    public LotLedger(int scale) {
        this.scale = scale;
    }

    /**
     * Appends a lot to the token's queue. A zero amount records nothing.
     *
     * @throws IllegalArgumentException on negative amount or cost basis, or when acquiredAt precedes the
     *                                  newest lot of the token
     */
    public void recordAcquisition(String token, BigDecimal amount, BigDecimal costBasisUsd,
                                  BigDecimal costBasisLocal, Instant acquiredAt) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(acquiredAt, "acquiredAt");
        requireNonNegative(amount, "amount");
        requireNonNegative(costBasisUsd, "costBasisUsd");
        requireNonNegative(costBasisLocal, "costBasisLocal");
        if (amount.signum() == 0) {
            return;
        }
        Deque<Lot> queue = lotsByToken.computeIfAbsent(token, t -> new ArrayDeque<>());
        Lot tail = queue.peekLast();
        if (tail != null && acquiredAt.isBefore(tail.getAcquiredAt())) {
            throw new IllegalArgumentException("Acquisition of " + token + " at " + acquiredAt
                    + " precedes newest lot at " + tail.getAcquiredAt());
        }
        queue.addLast(new Lot(token, amount, costBasisUsd, costBasisLocal, acquiredAt));
        acquiredByToken.merge(token, amount, BigDecimal::add);
    }

    /**
     * Consumes {@code amount} of the token oldest lot first. A head lot that is not larger than what is still
     * requested is taken whole and removed; otherwise it is split proportionally. When the queue runs dry the
     * shortfall is returned as unmatched and contributes no cost basis.
     */
    public LotConsumption consume(String token, BigDecimal amount) {
        Objects.requireNonNull(token, "token");
        requireNonNegative(amount, "amount");
        Deque<Lot> queue = lotsByToken.get(token);
        if (queue == null || queue.isEmpty() || amount.signum() == 0) {
            return LotConsumption.none(amount);
        }
        BigDecimal remaining = amount;
        BigDecimal basisUsd = BigDecimal.ZERO;
        BigDecimal basisLocal = BigDecimal.ZERO;
        while (remaining.signum() > 0 && !queue.isEmpty()) {
            Lot head = queue.peekFirst();
            if (head.getAmount().compareTo(remaining) <= 0) {
                basisUsd = basisUsd.add(head.getCostBasisUsd());
                basisLocal = basisLocal.add(head.getCostBasisLocal());
                remaining = remaining.subtract(head.getAmount());
                queue.pollFirst();
            } else {
                BigDecimal[] taken = head.split(remaining, scale);
                basisUsd = basisUsd.add(taken[0]);
                basisLocal = basisLocal.add(taken[1]);
                remaining = BigDecimal.ZERO;
            }
        }
        if (queue.isEmpty()) {
            lotsByToken.remove(token);
        }
        BigDecimal matched = amount.subtract(remaining);
        consumedByToken.merge(token, matched, BigDecimal::add);
        if (remaining.signum() > 0) {
            log.debug("Lots of {} exhausted; {} of {} unmatched", token, remaining, amount);
        }
        return new LotConsumption(basisUsd, basisLocal, matched, remaining);
    }

    /** Snapshot of the token's open lots, oldest first. Changes to the copies do not affect the ledger. */
    public List<Lot> openLots(String token) {
        Deque<Lot> queue = lotsByToken.get(token);
        if (queue == null) {
            return List.of();
        }
        return queue.stream().map(Lot::copy).toList();
    }

    public BigDecimal remainingAmount(String token) {
        Deque<Lot> queue = lotsByToken.get(token);
        if (queue == null) {
            return BigDecimal.ZERO;
        }
        return queue.stream().map(Lot::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal acquiredAmount(String token) {
        return acquiredByToken.getOrDefault(token, BigDecimal.ZERO);
    }

    /** Amount matched against lots so far; excludes unmatched shortfalls. */
    public BigDecimal consumedAmount(String token) {
        return consumedByToken.getOrDefault(token, BigDecimal.ZERO);
    }

    public int scale() {
        return scale;
    }

    private static void requireNonNegative(BigDecimal value, String field) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(field + " must be non-negative: " + value);
        }
    }
}
