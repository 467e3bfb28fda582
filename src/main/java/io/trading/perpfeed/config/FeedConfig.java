package io.trading.perpfeed.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the perpetual market-data feed.
 *
 * @param domain           OKX deployment
 * @param restBaseUrl      REST API base URL
 * @param publicWsUrl      Public websocket URL
 * @param tradingPairs     Canonical trading pairs to follow (e.g., "BTC-USDT")
 * @param connectTimeout   Websocket connect and handshake timeout
 * @param messageTimeout   Idle window after which a ping is sent
 * @param retryDelay       Fixed delay between reconnect attempts
 * @param subscribePacing  Delay between the three subscribe requests (zero relies on the transport throttler)
 * @param metricsPort      Port for the Prometheus metrics HTTP server
 * @param credentials      API credentials for signed REST calls, if configured
 */
public record FeedConfig(
    OkxDomain domain,
    String restBaseUrl,
    String publicWsUrl,
    List<String> tradingPairs,
    Duration connectTimeout,
    Duration messageTimeout,
    Duration retryDelay,
    Duration subscribePacing,
    int metricsPort,
    Optional<ApiCredentials> credentials
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_MESSAGE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);
    private static final int DEFAULT_METRICS_PORT = 9090;

    public FeedConfig {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (restBaseUrl == null || restBaseUrl.isEmpty()) {
            throw new IllegalArgumentException("restBaseUrl cannot be null or empty");
        }
        if (publicWsUrl == null || publicWsUrl.isEmpty()) {
            throw new IllegalArgumentException("publicWsUrl cannot be null or empty");
        }
        if (tradingPairs == null || tradingPairs.isEmpty()) {
            throw new IllegalArgumentException("tradingPairs cannot be null or empty");
        }
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(messageTimeout, "messageTimeout");
        requirePositive(retryDelay, "retryDelay");
        if (subscribePacing == null || subscribePacing.isNegative()) {
            throw new IllegalArgumentException("subscribePacing cannot be null or negative");
        }
        if (metricsPort < 1 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 1 and 65535");
        }
        tradingPairs = List.copyOf(tradingPairs);
        credentials = credentials == null ? Optional.empty() : credentials;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - OKX_DOMAIN: MAIN or DEMO (default: MAIN)
     * - OKX_REST_URL / OKX_WS_URL: override the domain URLs
     * - OKX_TRADING_PAIRS: comma separated canonical pairs (default: "BTC-USDT,ETH-USDT")
     * - OKX_CONNECT_TIMEOUT_MS, OKX_MESSAGE_TIMEOUT_MS, OKX_RETRY_DELAY_MS, OKX_SUBSCRIBE_PACING_MS
     * - METRICS_PORT (default: 9090)
     * - OKX_API_KEY, OKX_SECRET_KEY, OKX_PASSPHRASE: all three enable signed requests
     */
    public static FeedConfig fromEnv() {
        return fromSource(System::getenv);
    }

    static FeedConfig fromSource(Function<String, String> env) {
        Builder builder = builder();

        String domain = env.apply("OKX_DOMAIN");
        if (domain != null && !domain.isEmpty()) {
            builder.domain(OkxDomain.valueOf(domain.trim().toUpperCase()));
        }

        String restUrl = env.apply("OKX_REST_URL");
        if (restUrl != null && !restUrl.isEmpty()) {
            builder.restBaseUrl(restUrl);
        }
        String wsUrl = env.apply("OKX_WS_URL");
        if (wsUrl != null && !wsUrl.isEmpty()) {
            builder.publicWsUrl(wsUrl);
        }

        String pairs = env.apply("OKX_TRADING_PAIRS");
        if (pairs == null || pairs.isEmpty()) {
            pairs = "BTC-USDT,ETH-USDT";
        }
        Arrays.stream(pairs.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(String::toUpperCase)
            .forEach(builder::addTradingPair);

        builder.connectTimeout(Duration.ofMillis(parseLong(env, "OKX_CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT.toMillis())));
        builder.messageTimeout(Duration.ofMillis(parseLong(env, "OKX_MESSAGE_TIMEOUT_MS", DEFAULT_MESSAGE_TIMEOUT.toMillis())));
        builder.retryDelay(Duration.ofMillis(parseLong(env, "OKX_RETRY_DELAY_MS", DEFAULT_RETRY_DELAY.toMillis())));
        builder.subscribePacing(Duration.ofMillis(parseLong(env, "OKX_SUBSCRIBE_PACING_MS", 0)));
        builder.metricsPort(parseInt(env, "METRICS_PORT", DEFAULT_METRICS_PORT));

        String apiKey = env.apply("OKX_API_KEY");
        String secretKey = env.apply("OKX_SECRET_KEY");
        String passphrase = env.apply("OKX_PASSPHRASE");
        if (apiKey != null && !apiKey.isEmpty() && secretKey != null && !secretKey.isEmpty()) {
            builder.credentials(new ApiCredentials(apiKey, secretKey, passphrase == null ? "" : passphrase));
        }

        return builder.build();
    }

    private static long parseLong(Function<String, String> env, String key, long defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value: " + value, e);
        }
    }

    private static int parseInt(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "FeedConfig[domain=" + domain
            + ", restBaseUrl=" + restBaseUrl
            + ", publicWsUrl=" + publicWsUrl
            + ", tradingPairs=" + tradingPairs.stream().collect(Collectors.joining(",", "[", "]"))
            + ", messageTimeout=" + messageTimeout
            + ", retryDelay=" + retryDelay
            + ", signed=" + credentials.isPresent() + "]";
    }

    /**
     * Creates a new builder for FeedConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FeedConfig.
     */
    public static class Builder {
        private OkxDomain domain = OkxDomain.MAIN;
        private String restBaseUrl;
        private String publicWsUrl;
        private final List<String> tradingPairs = new ArrayList<>();
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration messageTimeout = DEFAULT_MESSAGE_TIMEOUT;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private Duration subscribePacing = Duration.ZERO;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private ApiCredentials credentials;

        public Builder domain(OkxDomain domain) {
            this.domain = domain;
            return this;
        }

        public Builder restBaseUrl(String restBaseUrl) {
            this.restBaseUrl = restBaseUrl;
            return this;
        }

        public Builder publicWsUrl(String publicWsUrl) {
            this.publicWsUrl = publicWsUrl;
            return this;
        }

        public Builder addTradingPair(String tradingPair) {
            if (!this.tradingPairs.contains(tradingPair)) {
                this.tradingPairs.add(tradingPair);
            }
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder messageTimeout(Duration messageTimeout) {
            this.messageTimeout = messageTimeout;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder subscribePacing(Duration subscribePacing) {
            this.subscribePacing = subscribePacing;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder credentials(ApiCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public FeedConfig build() {
            if (tradingPairs.isEmpty()) {
                throw new IllegalStateException("At least one trading pair must be added");
            }
            return new FeedConfig(
                domain,
                restBaseUrl != null ? restBaseUrl : domain.getRestBaseUrl(),
                publicWsUrl != null ? publicWsUrl : domain.getPublicWsUrl(),
                tradingPairs,
                connectTimeout,
                messageTimeout,
                retryDelay,
                subscribePacing,
                metricsPort,
                Optional.ofNullable(credentials)
            );
        }
    }
}
