package com.taxana.fx;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * USD → local currency rate source. Documented in application.yml under taxana.fx.
 */
@ConfigurationProperties(prefix = "taxana.fx")
@Getter
@Setter
public class FxProperties {

    /** ExchangeRate-API base; the rate comes from {baseUrl}/latest/USD. */
    private String baseUrl = "https://api.exchangerate-api.com/v4";

    private String currency = "IDR";

    /** Used when the rate service is unreachable or does not quote the currency. */
    private BigDecimal fallbackRate = new BigDecimal("15500");

    private Duration requestTimeout = Duration.ofSeconds(10);
}
