package io.trading.perpfeed.transport;

/**
 * Maps between canonical trading pairs and exchange-native instrument identifiers.
 */
public interface SymbolTranslator {

    /**
     * Canonical pair to exchange identifier, e.g. "BTC-USDT" to "BTC-USDT-SWAP".
     */
    String toNative(String tradingPair);

    /**
     * Exchange identifier to canonical pair.
     */
    String toCanonical(String nativeId);
}
