package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.perpfeed.transport.TransportException;
import io.trading.perpfeed.transport.WsSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OkxSubscriptionManagerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private WsSession session;

    @Test
    void testBuildBatchHasOneArgPerInstrument() {
        OkxSubscriptionManager manager = new OkxSubscriptionManager(mapper, new OkxSwapSymbolTranslator());

        SubscribeBatch batch = manager.buildSubscribeBatch(List.of("A", "B"));

        List<String> channels = List.of("trades", "books", "instruments");
        List<ObjectNode> requests = batch.inSendOrder();
        assertEquals(3, requests.size());
        for (int i = 0; i < requests.size(); i++) {
            JsonNode request = requests.get(i);
            assertEquals("subscribe", request.get("op").asText());
            JsonNode args = request.get("args");
            assertEquals(2, args.size());
            assertEquals(channels.get(i), args.get(0).get("channel").asText());
            assertEquals("A", args.get(0).get("instId").asText());
            assertEquals(channels.get(i), args.get(1).get("channel").asText());
            assertEquals("B", args.get(1).get("instId").asText());
        }
    }

    @Test
    void testSubscribeSendsTradesThenBooksThenInstruments() throws Exception {
        OkxSubscriptionManager manager = new OkxSubscriptionManager(mapper, new OkxSwapSymbolTranslator());

        manager.subscribe(session, List.of("BTC-USDT", "ETH-USDT"));

        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(session, times(3)).send(sent.capture());
        List<String> channels = List.of("trades", "books", "instruments");
        for (int i = 0; i < 3; i++) {
            JsonNode request = mapper.readTree(sent.getAllValues().get(i));
            assertEquals(channels.get(i), request.get("args").get(0).get("channel").asText());
            assertEquals("BTC-USDT-SWAP", request.get("args").get(0).get("instId").asText());
            assertEquals("ETH-USDT-SWAP", request.get("args").get(1).get("instId").asText());
        }
    }

    @Test
    void testPacingSleepsBetweenRequests() throws Exception {
        List<Duration> sleeps = new ArrayList<>();
        OkxSubscriptionManager manager = new OkxSubscriptionManager(
            mapper, new OkxSwapSymbolTranslator(), Duration.ofMillis(200), sleeps::add);

        manager.subscribe(session, List.of("BTC-USDT"));

        assertEquals(List.of(Duration.ofMillis(200), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void testSendFailurePropagates() throws Exception {
        OkxSubscriptionManager manager = new OkxSubscriptionManager(mapper, new OkxSwapSymbolTranslator());
        TransportException failure = new TransportException("closed");
        doThrow(failure).when(session).send(anyString());

        TransportException thrown = assertThrows(TransportException.class,
            () -> manager.subscribe(session, List.of("BTC-USDT")));
        assertSame(failure, thrown);
        verify(session, times(1)).send(anyString());
    }

    @Test
    void testInterruptionPropagates() throws Exception {
        OkxSubscriptionManager manager = new OkxSubscriptionManager(mapper, new OkxSwapSymbolTranslator());
        doThrow(new InterruptedException()).when(session).send(anyString());

        assertThrows(InterruptedException.class, () -> manager.subscribe(session, List.of("BTC-USDT")));
    }
}
