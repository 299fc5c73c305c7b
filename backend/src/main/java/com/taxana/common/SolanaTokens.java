package com.taxana.common;

import java.util.Map;
import java.util.Set;

/**
 * Well-known Solana mint addresses. Mints are base58 and case-sensitive, so lookups never normalise case.
 * Used as defaults for base-token and major-token configuration and for symbol display.
 */
public final class SolanaTokens {

    public static final String SOL = "So11111111111111111111111111111111111111112";
    public static final String USDC = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    public static final String USDT = "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB";
    public static final String MSOL = "mSoLzYCxHdYgdzU16g5QSh3i5K3z3KZK7ytfqcJm7So";
    public static final String BONK = "DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263";
    public static final String WORMHOLE_ETH = "7vfCXTUXx5WJV5JADk17DUJ4ksgau7utNKj4b963voxs";
    public static final String JUP = "JUPyiwrYJFskUPiHa7hkeR8VUtAeFoSYbKedZNsDvCN";

    /** Native coin plus the two major stablecoins. */
    public static final Set<String> DEFAULT_BASE_TOKENS = Set.of(SOL, USDC, USDT);

    /** Liquid tokens looked up often enough to be worth caching. */
    public static final Set<String> DEFAULT_MAJOR_TOKENS = Set.of(SOL, USDC, USDT, MSOL, BONK, WORMHOLE_ETH, JUP);

    private static final Map<String, String> SYMBOLS = Map.of(
            SOL, "SOL",
            USDC, "USDC",
            USDT, "USDT"
    );

    private SolanaTokens() {
    }

    /**
     * Symbol for display: the given symbol when present, otherwise the well-known symbol for the mint,
     * otherwise the mint abbreviated as {@code abcd...wxyz}.
     */
    public static String displaySymbol(String mint, String symbol) {
        if (symbol != null && !symbol.isBlank()) {
            return symbol.strip();
        }
        if (mint == null || mint.isBlank()) {
            return "";
        }
        String known = SYMBOLS.get(mint.strip());
        if (known != null) {
            return known;
        }
        String m = mint.strip();
        if (m.length() <= 8) {
            return m;
        }
        return m.substring(0, 4) + "..." + m.substring(m.length() - 4);
    }
}
