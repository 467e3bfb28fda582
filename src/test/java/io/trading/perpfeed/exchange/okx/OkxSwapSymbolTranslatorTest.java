package io.trading.perpfeed.exchange.okx;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OkxSwapSymbolTranslatorTest {

    private final OkxSwapSymbolTranslator translator = new OkxSwapSymbolTranslator();

    @Test
    void testToNative() {
        assertEquals("BTC-USDT-SWAP", translator.toNative("BTC-USDT"));
        assertEquals("BTC-USDT-SWAP", translator.toNative("btc-usdt"));
        assertEquals("BTC-USDT-SWAP", translator.toNative("BTC-USDT-SWAP"));
    }

    @Test
    void testToCanonical() {
        assertEquals("ETH-USDT", translator.toCanonical("ETH-USDT-SWAP"));
        assertEquals("ETH-USDT", translator.toCanonical("ETH-USDT"));
    }

    @Test
    void testRejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> translator.toNative(""));
        assertThrows(IllegalArgumentException.class, () -> translator.toCanonical(null));
    }
}
