package com.taxana.fx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Current USD rate from ExchangeRate-API GET /latest/USD (rates.{currency}). One attempt per run, no caching;
 * any failure yields the configured fallback rate.
 */
@RequiredArgsConstructor
@Slf4j
public class ExchangeRateApiResolver implements FxRateResolver {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FxProperties fxProperties;
    private final WebClient.Builder webClientBuilder;

    @Override
    public BigDecimal usdToLocalRate() {
        String currency = localCurrency();
        String url = fxProperties.getBaseUrl() + "/latest/USD";
        try {
            String response = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(fxProperties.getRequestTimeout());
            Optional<BigDecimal> rate = parseRate(response, currency);
            if (rate.isPresent()) {
                return rate.get();
            }
            log.warn("No USD/{} rate in response; using fallback {}", currency, fxProperties.getFallbackRate());
        } catch (WebClientResponseException e) {
            log.warn("USD/{} rate request failed: {}; using fallback {}", currency, e.getStatusCode(),
                    fxProperties.getFallbackRate());
        } catch (Exception e) {
            log.warn("USD/{} rate error; using fallback {}", currency, fxProperties.getFallbackRate(), e);
        }
        return fxProperties.getFallbackRate();
    }

    @Override
    public String localCurrency() {
        return fxProperties.getCurrency();
    }

    static Optional<BigDecimal> parseRate(String json, String currency) {
        if (json == null || currency == null) {
            return Optional.empty();
        }
        try {
            JsonNode rate = MAPPER.readTree(json).path("rates").path(currency);
            if (!rate.isNumber() || rate.decimalValue().signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(rate.decimalValue());
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
