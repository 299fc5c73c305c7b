package com.taxana.pricing.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.taxana.common.RateLimiter;
import com.taxana.pricing.TokenPriceResolver;
import com.taxana.pricing.WaterfallPriceResolver;
import com.taxana.pricing.cache.CaffeinePriceCache;
import com.taxana.pricing.cache.MongoPriceCache;
import com.taxana.pricing.cache.PriceCache;
import com.taxana.pricing.provider.BirdeyePriceProvider;
import com.taxana.pricing.provider.DexScreenerPriceProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.Executor;

/**
 * Pricing module wiring: providers, cache backend, lookup pool and the waterfall resolver.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    public static final String PRICE_LOOKUP_EXECUTOR = "price-lookup-executor";

    /** One thread per token of a batch; batches run one after another. */
    @Bean(name = PRICE_LOOKUP_EXECUTOR)
    public Executor priceLookupExecutor(PricingProperties pricingProperties) {
        int size = Math.max(1, pricingProperties.getBatchSize());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("price-lookup-");
        e.initialize();
        return e;
    }

    @Bean
    public RateLimiter dexscreenerRateLimiter(PricingProperties pricingProperties) {
        return new RateLimiter(pricingProperties.getDexscreener().getRequestsPerMinute());
    }

    @Bean
    public BirdeyePriceProvider birdeyePriceProvider(PricingProperties pricingProperties,
                                                     WebClient.Builder webClientBuilder) {
        return new BirdeyePriceProvider(pricingProperties, webClientBuilder);
    }

    @Bean
    public DexScreenerPriceProvider dexScreenerPriceProvider(PricingProperties pricingProperties,
                                                             WebClient.Builder webClientBuilder,
                                                             RateLimiter dexscreenerRateLimiter) {
        return new DexScreenerPriceProvider(pricingProperties, webClientBuilder, dexscreenerRateLimiter);
    }

    @Bean
    public PriceCache priceCache(PricingProperties pricingProperties, ObjectProvider<MongoTemplate> mongoTemplate) {
        if (pricingProperties.getCacheStore() == PricingProperties.CacheStore.MONGO) {
            return new MongoPriceCache(mongoTemplate.getObject());
        }
        return new CaffeinePriceCache(Caffeine.newBuilder()
                .maximumSize(pricingProperties.getMemoryCacheMaxTokens())
                .build());
    }

    @Bean
    public TokenPriceResolver tokenPriceResolver(PricingProperties pricingProperties,
                                                 PriceCache priceCache,
                                                 BirdeyePriceProvider birdeyePriceProvider,
                                                 DexScreenerPriceProvider dexScreenerPriceProvider,
                                                 @Qualifier(PRICE_LOOKUP_EXECUTOR) Executor priceLookupExecutor) {
        return new WaterfallPriceResolver(pricingProperties, priceCache,
                birdeyePriceProvider, dexScreenerPriceProvider, priceLookupExecutor);
    }
}
