package io.trading.perpfeed.exchange.okx;

import io.trading.perpfeed.transport.SymbolTranslator;

/**
 * Translates canonical pairs to OKX perpetual swap instrument ids.
 * "BTC-USDT" maps to "BTC-USDT-SWAP" and back.
 */
public class OkxSwapSymbolTranslator implements SymbolTranslator {

    private static final String SWAP_SUFFIX = "-SWAP";

    @Override
    public String toNative(String tradingPair) {
        if (tradingPair == null || tradingPair.isEmpty()) {
            throw new IllegalArgumentException("tradingPair cannot be null or empty");
        }
        String upper = tradingPair.toUpperCase();
        return upper.endsWith(SWAP_SUFFIX) ? upper : upper + SWAP_SUFFIX;
    }

    @Override
    public String toCanonical(String nativeId) {
        if (nativeId == null || nativeId.isEmpty()) {
            throw new IllegalArgumentException("nativeId cannot be null or empty");
        }
        if (nativeId.endsWith(SWAP_SUFFIX)) {
            return nativeId.substring(0, nativeId.length() - SWAP_SUFFIX.length());
        }
        return nativeId;
    }
}
