package com.taxana.pricing;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.taxana.common.SolanaTokens;
import com.taxana.domain.PriceSource;
import com.taxana.pricing.cache.CaffeinePriceCache;
import com.taxana.pricing.cache.PriceCache;
import com.taxana.pricing.config.PricingProperties;
import com.taxana.pricing.provider.MarketPriceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WaterfallPriceResolverTest {

    private static final String MICRO_CAP = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";
    private static final Instant AT = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    MarketPriceProvider primary;
    @Mock
    MarketPriceProvider secondary;
    @Mock
    PriceCache priceCache;

    private PricingProperties props;
    private WaterfallPriceResolver resolver;

    @BeforeEach
    void setUp() {
        props = new PricingProperties();
        props.setBatchPause(Duration.ZERO);
        when(primary.name()).thenReturn("primary");
        when(secondary.name()).thenReturn("secondary");
        when(priceCache.find(anyString(), any(), any())).thenReturn(Optional.empty());
        resolver = new WaterfallPriceResolver(props, priceCache, primary, secondary, Runnable::run);
    }

    @Test
    @DisplayName("cache hit for a major token returns CACHE without calling providers")
    void cacheHitForMajor() {
        when(priceCache.find(SolanaTokens.SOL, AT, Duration.ofHours(3))).thenReturn(Optional.of(new BigDecimal("150")));

        PriceQuote quote = resolver.resolvePrice(SolanaTokens.SOL, AT);

        assertThat(quote.getSource()).isEqualTo(PriceSource.CACHE);
        assertThat(quote.isFromCache()).isTrue();
        assertThat(quote.getPriceUsd()).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("150"));
        verifyNoInteractions(primary, secondary);
    }

    @Test
    @DisplayName("primary price for a major token is returned and cached")
    void primaryCachedForMajor() {
        when(primary.fetchPriceUsd(SolanaTokens.SOL)).thenReturn(Optional.of(new BigDecimal("151.2")));

        PriceQuote quote = resolver.resolvePrice(SolanaTokens.SOL, AT);

        assertThat(quote.getSource()).isEqualTo(PriceSource.PRIMARY);
        assertThat(quote.isFromCache()).isFalse();
        verify(priceCache).putIfAbsent(SolanaTokens.SOL, AT, new BigDecimal("151.2"), PriceSource.PRIMARY);
        verifyNoInteractions(secondary);
    }

    @Test
    @DisplayName("non-major token skips the cache entirely")
    void nonMajorNotCached() {
        when(primary.fetchPriceUsd(MICRO_CAP)).thenReturn(Optional.of(new BigDecimal("0.00042")));

        PriceQuote quote = resolver.resolvePrice(MICRO_CAP, AT);

        assertThat(quote.getSource()).isEqualTo(PriceSource.PRIMARY);
        verify(priceCache, never()).find(anyString(), any(), any());
        verify(priceCache, never()).putIfAbsent(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("primary miss falls through to secondary")
    void secondaryAfterPrimaryMiss() {
        when(primary.fetchPriceUsd(MICRO_CAP)).thenReturn(Optional.empty());
        when(secondary.fetchPriceUsd(MICRO_CAP)).thenReturn(Optional.of(new BigDecimal("0.0031")));

        PriceQuote quote = resolver.resolvePrice(MICRO_CAP, AT);

        assertThat(quote.getSource()).isEqualTo(PriceSource.SECONDARY);
        assertThat(quote.getPriceUsd()).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("0.0031"));
    }

    @Test
    @DisplayName("provider exception is treated as no price from that source")
    void providerExceptionDegrades() {
        when(primary.fetchPriceUsd(MICRO_CAP)).thenThrow(new IllegalStateException("boom"));
        when(secondary.fetchPriceUsd(MICRO_CAP)).thenReturn(Optional.of(new BigDecimal("2")));

        assertThat(resolver.resolvePrice(MICRO_CAP, AT).getSource()).isEqualTo(PriceSource.SECONDARY);
    }

    @Test
    @DisplayName("both providers empty yields NONE with null price")
    void noneWhenAllFail() {
        when(primary.fetchPriceUsd(MICRO_CAP)).thenReturn(Optional.empty());
        when(secondary.fetchPriceUsd(MICRO_CAP)).thenReturn(Optional.empty());

        PriceQuote quote = resolver.resolvePrice(MICRO_CAP, AT);

        assertThat(quote.getSource()).isEqualTo(PriceSource.NONE);
        assertThat(quote.isPriced()).isFalse();
        assertThat(quote.getPriceUsd()).isEmpty();
        assertThat(quote.priceOrZero()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("cache write failure does not fail the lookup")
    void cacheWriteFailureIgnored() {
        when(primary.fetchPriceUsd(SolanaTokens.USDC)).thenReturn(Optional.of(BigDecimal.ONE));
        doThrow(new IllegalStateException("store down")).when(priceCache)
                .putIfAbsent(anyString(), any(), any(), any());

        assertThat(resolver.resolvePrice(SolanaTokens.USDC, AT).getSource()).isEqualTo(PriceSource.PRIMARY);
    }

    @Test
    @DisplayName("secondary quote is cached and a later lookup inside the window is served from cache")
    void secondaryThenCache() {
        PriceCache cache = new CaffeinePriceCache(Caffeine.newBuilder().maximumSize(100).build());
        WaterfallPriceResolver withCache = new WaterfallPriceResolver(props, cache, primary, secondary, Runnable::run);
        when(primary.fetchPriceUsd(SolanaTokens.BONK)).thenReturn(Optional.empty());
        when(secondary.fetchPriceUsd(SolanaTokens.BONK)).thenReturn(Optional.of(new BigDecimal("0.000021")));

        PriceQuote first = withCache.resolvePrice(SolanaTokens.BONK, AT);
        PriceQuote second = withCache.resolvePrice(SolanaTokens.BONK, AT.plus(Duration.ofHours(2)));

        assertThat(first.getSource()).isEqualTo(PriceSource.SECONDARY);
        assertThat(second.getSource()).isEqualTo(PriceSource.CACHE);
        assertThat(second.getPriceUsd()).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("0.000021"));
        verify(primary, times(1)).fetchPriceUsd(SolanaTokens.BONK);
        verify(secondary, times(1)).fetchPriceUsd(SolanaTokens.BONK);
    }

    @Test
    @DisplayName("cache read failure is a miss and the lookup falls through to the primary provider")
    void cacheReadFailureIgnored() {
        when(priceCache.find(anyString(), any(), any())).thenThrow(new IllegalStateException("store down"));
        when(primary.fetchPriceUsd(anyString())).thenReturn(Optional.of(new BigDecimal("148")));

        Map<String, PriceQuote> quotes = resolver.resolvePrices(List.of(SolanaTokens.SOL, MICRO_CAP), AT);

        assertThat(quotes.get(SolanaTokens.SOL).getSource()).isEqualTo(PriceSource.PRIMARY);
        assertThat(quotes.get(SolanaTokens.SOL).getPriceUsd())
                .hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("148"));
        assertThat(quotes.get(MICRO_CAP).getSource()).isEqualTo(PriceSource.PRIMARY);
    }

    @Test
    @DisplayName("batch resolves each distinct token once across several batches")
    void batchDeduplicates() {
        props.setBatchSize(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            resolver = new WaterfallPriceResolver(props, priceCache, primary, secondary, pool);
            when(primary.fetchPriceUsd(anyString())).thenReturn(Optional.of(BigDecimal.TEN));

            Map<String, PriceQuote> quotes = resolver.resolvePrices(
                    List.of("A", "B", "A", "C", "D", "B", "E"), AT);

            assertThat(quotes).containsOnlyKeys("A", "B", "C", "D", "E");
            assertThat(quotes.values()).allSatisfy(q -> assertThat(q.getSource()).isEqualTo(PriceSource.PRIMARY));
            verify(primary, times(1)).fetchPriceUsd("A");
            verify(primary, times(1)).fetchPriceUsd("B");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("at most batchSize lookups run at once and batches are separated by the pause")
    void batchConcurrencyAndPause() {
        props.setBatchSize(2);
        props.setBatchPause(Duration.ofMillis(150));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            resolver = new WaterfallPriceResolver(props, priceCache, primary, secondary, pool);
            when(primary.fetchPriceUsd(anyString())).thenAnswer(inv -> {
                peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                Thread.sleep(50);
                inFlight.decrementAndGet();
                return Optional.of(BigDecimal.ONE);
            });

            long start = System.nanoTime();
            Map<String, PriceQuote> quotes = resolver.resolvePrices(List.of("A", "B", "C", "D", "E"), AT);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertThat(quotes).hasSize(5);
            assertThat(peak.get()).isBetween(1, 2);
            // three batches, two pauses between them
            assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("blank token is unpriced without any lookups")
    void blankToken() {
        assertThat(resolver.resolvePrice(" ", AT).getSource()).isEqualTo(PriceSource.NONE);
        verifyNoInteractions(primary, secondary);
    }
}
