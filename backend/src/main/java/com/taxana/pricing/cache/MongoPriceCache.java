package com.taxana.pricing.cache;

import com.taxana.domain.PriceSource;
import com.taxana.domain.TokenPrice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed price cache on token_prices. The unique (tokenAddress, timestamp) index turns a
 * conflicting insert into DuplicateKeyException, which is dropped so the first writer wins.
 */
@RequiredArgsConstructor
@Slf4j
public class MongoPriceCache implements PriceCache {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<BigDecimal> find(String token, Instant at, Duration window) {
        Query query = new Query(where("tokenAddress").is(token)
                .and("timestamp").gte(at.minus(window)).lte(at.plus(window)));
        query.limit(1);
        try {
            TokenPrice hit = mongoTemplate.findOne(query, TokenPrice.class);
            if (hit == null || hit.getPriceUsd() == null) {
                return Optional.empty();
            }
            return Optional.of(hit.getPriceUsd());
        } catch (DataAccessException e) {
            log.warn("Price cache read failed for {}: {}", token, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean putIfAbsent(String token, Instant at, BigDecimal priceUsd, PriceSource source) {
        try {
            mongoTemplate.insert(TokenPrice.of(token, at, priceUsd, source));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Price for {} at {} already cached", token, at);
            return false;
        } catch (DataAccessException e) {
            log.warn("Price cache write failed for {} at {}: {}", token, at, e.getMessage());
            return false;
        }
    }
}
