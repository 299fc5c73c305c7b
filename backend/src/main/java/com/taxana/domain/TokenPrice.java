package com.taxana.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Cached USD quote for a major token. Unique on (tokenAddress, timestamp): the first writer wins and later
 * inserts for the same key are dropped. priceUsd is stored as Decimal128.
 */
@Document(collection = "token_prices")
@CompoundIndex(name = "token_timestamp", def = "{'tokenAddress': 1, 'timestamp': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenPrice {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String tokenAddress;
    private Instant timestamp;
    private BigDecimal priceUsd;
    /** Waterfall tier that produced the quote (PRIMARY or SECONDARY). */
    private PriceSource source;
    private Instant createdAt;

    public static TokenPrice of(String tokenAddress, Instant timestamp, BigDecimal priceUsd, PriceSource source) {
        TokenPrice p = new TokenPrice();
        p.setTokenAddress(tokenAddress);
        p.setTimestamp(timestamp);
        p.setPriceUsd(priceUsd);
        p.setSource(source);
        p.setCreatedAt(Instant.now());
        return p;
    }
}
