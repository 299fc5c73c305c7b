package com.taxana.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxana.common.RateLimiter;
import com.taxana.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Secondary source: DexScreener GET /latest/dex/tokens/{mint}. Quotes come per trading pair; the pair with the
 * greatest USD liquidity wins because thin pairs report unreliable prices. Good coverage for micro-caps.
 */
@RequiredArgsConstructor
@Slf4j
public class DexScreenerPriceProvider implements MarketPriceProvider {

    private static final int SCALE = 18;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;

    @Override
    public String name() {
        return "dexscreener";
    }

    @Override
    public Optional<BigDecimal> fetchPriceUsd(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String url = pricingProperties.getDexscreener().getBaseUrl() + "/latest/dex/tokens/" + token;
        try {
            rateLimiter.acquire();
            String response = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(pricingProperties.getRequestTimeout());
            return parseMostLiquidPrice(response);
        } catch (WebClientResponseException e) {
            log.warn("DexScreener price failed for {}: {}", token, e.getStatusCode());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("DexScreener price error for {}", token, e);
            return Optional.empty();
        }
    }

    /**
     * priceUsd of the pair with the highest liquidity.usd (missing liquidity counts as zero; first pair wins ties).
     */
    static Optional<BigDecimal> parseMostLiquidPrice(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode pairs = MAPPER.readTree(json).path("pairs");
            if (!pairs.isArray() || pairs.isEmpty()) {
                return Optional.empty();
            }
            JsonNode best = null;
            BigDecimal bestLiquidity = null;
            for (JsonNode pair : pairs) {
                JsonNode liq = pair.path("liquidity").path("usd");
                BigDecimal liquidity = liq.isNumber() ? liq.decimalValue() : BigDecimal.ZERO;
                if (best == null || liquidity.compareTo(bestLiquidity) > 0) {
                    best = pair;
                    bestLiquidity = liquidity;
                }
            }
            return parsePrice(best.path("priceUsd"));
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static Optional<BigDecimal> parsePrice(JsonNode node) {
        BigDecimal price;
        if (node.isNumber()) {
            price = node.decimalValue();
        } else if (node.isTextual() && !node.asText().isBlank()) {
            try {
                price = new BigDecimal(node.asText().strip());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        if (price.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(price.setScale(SCALE, RoundingMode.HALF_UP));
    }
}
