package io.trading.perpfeed.config;

/**
 * OKX deployments the feed can point at.
 */
public enum OkxDomain {
    MAIN("https://www.okx.com", "wss://ws.okx.com:8443/ws/v5/public", false),
    DEMO("https://www.okx.com", "wss://wspap.okx.com:8443/ws/v5/public?brokerId=9999", true);

    private final String restBaseUrl;
    private final String publicWsUrl;
    private final boolean simulatedTrading;

    OkxDomain(String restBaseUrl, String publicWsUrl, boolean simulatedTrading) {
        this.restBaseUrl = restBaseUrl;
        this.publicWsUrl = publicWsUrl;
        this.simulatedTrading = simulatedTrading;
    }

    public String getRestBaseUrl() {
        return restBaseUrl;
    }

    public String getPublicWsUrl() {
        return publicWsUrl;
    }

    /**
     * Demo trading requires the "x-simulated-trading: 1" header on every REST call.
     */
    public boolean isSimulatedTrading() {
        return simulatedTrading;
    }
}
