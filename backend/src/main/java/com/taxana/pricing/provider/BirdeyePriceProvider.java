package com.taxana.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxana.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Primary source: Birdeye GET /defi/price?address={mint} with X-API-KEY. Disabled while no key is configured.
 */
@RequiredArgsConstructor
@Slf4j
public class BirdeyePriceProvider implements MarketPriceProvider {

    static final String PLACEHOLDER_API_KEY = "your_birdeye_api_key_here";

    private static final int SCALE = 18;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;

    @Override
    public String name() {
        return "birdeye";
    }

    public boolean isEnabled() {
        String key = pricingProperties.getBirdeye().getApiKey();
        return key != null && !key.isBlank() && !PLACEHOLDER_API_KEY.equals(key);
    }

    @Override
    public Optional<BigDecimal> fetchPriceUsd(String token) {
        if (token == null || token.isBlank() || !isEnabled()) {
            return Optional.empty();
        }
        String url = pricingProperties.getBirdeye().getBaseUrl() + "/defi/price?address=" + token;
        try {
            String response = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .header("X-API-KEY", pricingProperties.getBirdeye().getApiKey())
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(pricingProperties.getRequestTimeout());
            return parseUsdPrice(response);
        } catch (WebClientResponseException e) {
            log.warn("Birdeye price failed for {}: {}", token, e.getStatusCode());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Birdeye price error for {}", token, e);
            return Optional.empty();
        }
    }

    /** Reads data.value; zero, negative or missing values are no price. */
    static Optional<BigDecimal> parseUsdPrice(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode value = MAPPER.readTree(json).path("data").path("value");
            if (!value.isNumber() || value.decimalValue().signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(value.decimalValue().setScale(SCALE, RoundingMode.HALF_UP));
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
