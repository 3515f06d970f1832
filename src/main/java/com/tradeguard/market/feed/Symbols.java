package com.tradeguard.market.feed;

/**
 * Converts between the canonical symbol form ({@code BTCUSDT}) and the base
 * asset each exchange builds its own pair names from.
 */
final class Symbols {

    static final String CANONICAL_QUOTE = "USDT";

    private Symbols() {}

    static String baseAsset(String symbol) {
        String upper = symbol.toUpperCase();
        if (upper.endsWith(CANONICAL_QUOTE) && upper.length() > CANONICAL_QUOTE.length()) {
            return upper.substring(0, upper.length() - CANONICAL_QUOTE.length());
        }
        if (upper.endsWith("USD") && upper.length() > 3) {
            return upper.substring(0, upper.length() - 3);
        }
        return upper;
    }

    static String canonical(String baseAsset) {
        return baseAsset.toUpperCase() + CANONICAL_QUOTE;
    }
}
