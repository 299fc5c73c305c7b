package com.taxana.fx;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(FxProperties.class)
public class FxConfig {

    @Bean
    public FxRateResolver fxRateResolver(FxProperties fxProperties, WebClient.Builder webClientBuilder) {
        return new ExchangeRateApiResolver(fxProperties, webClientBuilder);
    }
}
