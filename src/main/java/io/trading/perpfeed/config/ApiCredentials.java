package io.trading.perpfeed.config;

/**
 * OKX API key triple used to sign authenticated REST requests.
 *
 * @param apiKey     API key
 * @param secretKey  Secret used for HMAC signing
 * @param passphrase Passphrase chosen when the key was created
 */
public record ApiCredentials(
    String apiKey,
    String secretKey,
    String passphrase
) {
    public ApiCredentials {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalArgumentException("apiKey cannot be null or empty");
        }
        if (secretKey == null || secretKey.isEmpty()) {
            throw new IllegalArgumentException("secretKey cannot be null or empty");
        }
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase cannot be null");
        }
    }

    @Override
    public String toString() {
        return "ApiCredentials[apiKey=" + apiKey + ", secretKey=***, passphrase=***]";
    }
}
