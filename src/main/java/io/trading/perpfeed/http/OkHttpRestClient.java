package io.trading.perpfeed.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.perpfeed.transport.MalformedResponseException;
import io.trading.perpfeed.transport.RestClient;
import io.trading.perpfeed.transport.RestRequest;
import io.trading.perpfeed.transport.TransportException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * OkHttp-based REST client for the OKX v5 API.
 *
 * Responses must be HTTP 2xx and carry "code":"0"; anything else is a
 * {@link TransportException}. Requests flagged as authenticated are signed when a signer
 * is configured and sent unsigned otherwise.
 */
public class OkHttpRestClient implements RestClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OkHttpRestClient.class);

    private static final String SIMULATED_TRADING_HEADER = "x-simulated-trading";

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final OkxRequestSigner signer;
    private final boolean simulatedTrading;

    public OkHttpRestClient(ObjectMapper mapper, OkxRequestSigner signer, boolean simulatedTrading) {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build(),
            mapper, signer, simulatedTrading);
    }

    /**
     * @param signer Signer for authenticated requests; null to send them unsigned
     */
    public OkHttpRestClient(OkHttpClient client, ObjectMapper mapper, OkxRequestSigner signer, boolean simulatedTrading) {
        this.client = client;
        this.mapper = mapper;
        this.signer = signer;
        this.simulatedTrading = simulatedTrading;
    }

    @Override
    public JsonNode execute(RestRequest request) throws TransportException {
        HttpUrl base = HttpUrl.parse(request.url());
        if (base == null) {
            throw new TransportException("Invalid URL: " + request.url());
        }
        HttpUrl.Builder urlBuilder = base.newBuilder();
        request.params().forEach(urlBuilder::addQueryParameter);
        HttpUrl url = urlBuilder.build();

        Request.Builder builder = new Request.Builder().url(url).get();
        if (simulatedTrading) {
            builder.header(SIMULATED_TRADING_HEADER, "1");
        }
        if (request.authRequired()) {
            if (signer != null) {
                String requestPath = url.encodedPath() + (url.encodedQuery() != null ? "?" + url.encodedQuery() : "");
                signer.headers(request.method().name(), requestPath, "").forEach(builder::header);
            } else {
                LOGGER.debug("No credentials configured, sending {} unsigned", url.encodedPath());
            }
        }

        LOGGER.debug("{} {} (limit={})", request.method(), url, request.limitId());
        try (Response response = client.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new TransportException("OKX API error: " + response.code() + " " + response.message() + " " + text);
            }

            JsonNode root = mapper.readTree(text);
            JsonNode code = root.get("code");
            if (code != null && !"0".equals(code.asText())) {
                JsonNode msg = root.get("msg");
                throw new TransportException("OKX API error: " + code.asText() + " " + (msg != null ? msg.asText() : "Unknown error"));
            }
            return root;
        } catch (TransportException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Invalid JSON from " + url.encodedPath(), e);
        } catch (IOException e) {
            throw new TransportException("Request to " + url.encodedPath() + " failed", e);
        }
    }
}
