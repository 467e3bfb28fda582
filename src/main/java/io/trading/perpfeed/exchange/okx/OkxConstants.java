package io.trading.perpfeed.exchange.okx;

/**
 * OKX v5 endpoints, channel names and protocol literals used by the perpetual feed.
 */
public final class OkxConstants {

    public static final String ORDER_BOOK_PATH = "/api/v5/market/books";
    public static final String TICKERS_PATH = "/api/v5/market/tickers";
    public static final String INDEX_TICKERS_PATH = "/api/v5/market/index-tickers";
    public static final String MARK_PRICE_PATH = "/api/v5/public/mark-price";
    public static final String FUNDING_RATE_PATH = "/api/v5/public/funding-rate";

    public static final String SNAPSHOT_DEPTH = "100";
    public static final String INST_TYPE_SWAP = "SWAP";

    public static final String WS_TRADES_CHANNEL = "trades";
    public static final String WS_ORDER_BOOK_CHANNEL = "books";
    public static final String WS_INSTRUMENTS_CHANNEL = "instruments";

    public static final String WS_PING = "ping";
    public static final String WS_PONG = "pong";

    public static final String ACTION_UPDATE = "update";
    public static final String TYPE_DELTA = "delta";

    private OkxConstants() {
    }

    public static String restUrl(String baseUrl, String path) {
        if (baseUrl.endsWith("/")) {
            return baseUrl.substring(0, baseUrl.length() - 1) + path;
        }
        return baseUrl + path;
    }

    /**
     * Throttler bucket for an endpoint. Mark price is limited per instrument.
     */
    public static String limitId(String path) {
        return path;
    }

    public static String limitId(String path, String tradingPair) {
        return path + "-" + tradingPair;
    }
}
