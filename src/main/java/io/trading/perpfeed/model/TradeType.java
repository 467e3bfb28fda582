package io.trading.perpfeed.model;

/**
 * Trade side, carrying the numeric tag used by downstream consumers.
 */
public enum TradeType {
    BUY(1),
    SELL(2);

    private final int value;

    TradeType(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Maps an OKX side string. Anything other than "buy" is a sell.
     */
    public static TradeType fromSide(String side) {
        return "buy".equals(side) ? BUY : SELL;
    }
}
