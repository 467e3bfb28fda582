package io.trading.perpfeed.http;

import io.trading.perpfeed.config.ApiCredentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs OKX v5 REST requests.
 *
 * sign = Base64(HMAC-SHA256(secret, timestamp + METHOD + requestPath + body)), where
 * requestPath includes the query string and timestamp is ISO-8601 UTC with milliseconds.
 */
public class OkxRequestSigner {

    static final String HEADER_KEY = "OK-ACCESS-KEY";
    static final String HEADER_SIGN = "OK-ACCESS-SIGN";
    static final String HEADER_TIMESTAMP = "OK-ACCESS-TIMESTAMP";
    static final String HEADER_PASSPHRASE = "OK-ACCESS-PASSPHRASE";

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final ApiCredentials credentials;
    private final Clock clock;

    public OkxRequestSigner(ApiCredentials credentials) {
        this(credentials, Clock.systemUTC());
    }

    OkxRequestSigner(ApiCredentials credentials, Clock clock) {
        this.credentials = credentials;
        this.clock = clock;
    }

    /**
     * Returns the authentication headers for one request.
     *
     * @param method      HTTP method, upper case
     * @param requestPath Path plus query string, e.g. "/api/v5/public/mark-price?instId=BTC-USDT-SWAP"
     * @param body        Request body, empty for GET
     */
    public Map<String, String> headers(String method, String requestPath, String body) {
        String timestamp = TIMESTAMP_FORMAT.format(Instant.now(clock));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_KEY, credentials.apiKey());
        headers.put(HEADER_SIGN, sign(timestamp + method + requestPath + body));
        headers.put(HEADER_TIMESTAMP, timestamp);
        headers.put(HEADER_PASSPHRASE, credentials.passphrase());
        return headers;
    }

    String sign(String prehash) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(credentials.secretKey().getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return Base64.getEncoder().encodeToString(mac.doFinal(prehash.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
