package io.trading.perpfeed.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.perpfeed.config.ApiCredentials;
import io.trading.perpfeed.transport.MalformedResponseException;
import io.trading.perpfeed.transport.RestRequest;
import io.trading.perpfeed.transport.TransportException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against an interceptor that answers locally and records the outgoing request.
 */
class OkHttpRestClientTest {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String MARK_PRICE_URL = "https://www.okx.com/api/v5/public/mark-price";

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<Request> sent = new AtomicReference<>();

    private OkHttpClient respondingWith(int code, String body) {
        return new OkHttpClient.Builder()
            .addInterceptor(chain -> {
                sent.set(chain.request());
                return new Response.Builder()
                    .request(chain.request())
                    .protocol(Protocol.HTTP_1_1)
                    .code(code)
                    .message(code == 200 ? "OK" : "Error")
                    .body(ResponseBody.create(body, JSON))
                    .build();
            })
            .build();
    }

    private OkHttpClient failingWith(IOException error) {
        return new OkHttpClient.Builder()
            .addInterceptor(chain -> {
                throw error;
            })
            .build();
    }

    private static Map<String, String> markParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("instId", "BTC-USDT-SWAP");
        params.put("instType", "SWAP");
        return params;
    }

    @Test
    void testGetWithQueryParameters() throws Exception {
        OkHttpRestClient client = new OkHttpRestClient(
            respondingWith(200, "{\"code\":\"0\",\"data\":[{\"markPx\":\"101\"}]}"), mapper, null, false);

        JsonNode response = client.execute(RestRequest.get(MARK_PRICE_URL, markParams(), null));

        assertEquals("101", response.get("data").get(0).get("markPx").asText());
        assertEquals("GET", sent.get().method());
        assertEquals("BTC-USDT-SWAP", sent.get().url().queryParameter("instId"));
        assertEquals("SWAP", sent.get().url().queryParameter("instType"));
        assertNull(sent.get().header(OkxRequestSigner.HEADER_SIGN));
        assertNull(sent.get().header("x-simulated-trading"));
    }

    @Test
    void testAuthenticatedRequestIsSigned() throws Exception {
        OkxRequestSigner signer = new OkxRequestSigner(new ApiCredentials("api", "secret", "pass"));
        OkHttpRestClient client = new OkHttpRestClient(
            respondingWith(200, "{\"code\":\"0\",\"data\":[]}"), mapper, signer, true);

        client.execute(RestRequest.authenticatedGet(MARK_PRICE_URL, markParams(), null));

        Request request = sent.get();
        assertEquals("api", request.header(OkxRequestSigner.HEADER_KEY));
        assertEquals("pass", request.header(OkxRequestSigner.HEADER_PASSPHRASE));
        assertNotNull(request.header(OkxRequestSigner.HEADER_TIMESTAMP));
        String expected = signer.sign(request.header(OkxRequestSigner.HEADER_TIMESTAMP)
            + "GET/api/v5/public/mark-price?instId=BTC-USDT-SWAP&instType=SWAP");
        assertEquals(expected, request.header(OkxRequestSigner.HEADER_SIGN));
        assertEquals("1", request.header("x-simulated-trading"));
    }

    @Test
    void testAuthenticatedRequestWithoutCredentialsIsSentUnsigned() throws Exception {
        OkHttpRestClient client = new OkHttpRestClient(
            respondingWith(200, "{\"code\":\"0\",\"data\":[]}"), mapper, null, false);

        client.execute(RestRequest.authenticatedGet(MARK_PRICE_URL, markParams(), null));

        assertNull(sent.get().header(OkxRequestSigner.HEADER_SIGN));
    }

    @Test
    void testNonZeroCodeIsTransportError() {
        OkHttpRestClient client = new OkHttpRestClient(
            respondingWith(200, "{\"code\":\"51001\",\"msg\":\"Instrument ID does not exist\",\"data\":[]}"),
            mapper, null, false);

        TransportException e = assertThrows(TransportException.class,
            () -> client.execute(RestRequest.get(MARK_PRICE_URL, markParams(), null)));
        assertTrue(e.getMessage().contains("51001"));
    }

    @Test
    void testHttpErrorIsTransportError() {
        OkHttpRestClient client = new OkHttpRestClient(respondingWith(429, "{}"), mapper, null, false);

        assertThrows(TransportException.class,
            () -> client.execute(RestRequest.get(MARK_PRICE_URL, markParams(), null)));
    }

    @Test
    void testIoFailureIsTransportError() {
        IOException cause = new IOException("connection reset");
        OkHttpRestClient client = new OkHttpRestClient(failingWith(cause), mapper, null, false);

        TransportException e = assertThrows(TransportException.class,
            () -> client.execute(RestRequest.get(MARK_PRICE_URL, markParams(), null)));
        assertEquals("connection reset", e.getCause().getMessage());
    }

    @Test
    void testInvalidJsonIsMalformed() {
        OkHttpRestClient client = new OkHttpRestClient(respondingWith(200, "not json"), mapper, null, false);

        assertThrows(MalformedResponseException.class,
            () -> client.execute(RestRequest.get(MARK_PRICE_URL, markParams(), null)));
    }
}
