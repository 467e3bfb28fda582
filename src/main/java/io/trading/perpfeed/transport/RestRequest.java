package io.trading.perpfeed.transport;

import java.util.Map;

/**
 * A single REST call handed to the transport.
 *
 * @param url          Absolute endpoint URL without query string
 * @param method       HTTP method
 * @param params       Query parameters, iteration order preserved
 * @param limitId      Throttler bucket this request is charged against
 * @param authRequired Whether the request must be signed
 */
public record RestRequest(
    String url,
    RestMethod method,
    Map<String, String> params,
    String limitId,
    boolean authRequired
) {
    public RestRequest {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("url cannot be null or empty");
        }
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        params = params == null ? Map.of() : params;
        if (limitId == null || limitId.isEmpty()) {
            limitId = url;
        }
    }

    public static RestRequest get(String url, Map<String, String> params, String limitId) {
        return new RestRequest(url, RestMethod.GET, params, limitId, false);
    }

    public static RestRequest authenticatedGet(String url, Map<String, String> params, String limitId) {
        return new RestRequest(url, RestMethod.GET, params, limitId, true);
    }
}
