package io.trading.perpfeed;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.perpfeed.config.FeedConfig;
import io.trading.perpfeed.exchange.okx.OkxPerpetualDataSource;
import io.trading.perpfeed.exchange.okx.OkxSwapSymbolTranslator;
import io.trading.perpfeed.http.OkHttpRestClient;
import io.trading.perpfeed.http.OkxRequestSigner;
import io.trading.perpfeed.metrics.FeedMetrics;
import io.trading.perpfeed.metrics.MetricsServer;
import io.trading.perpfeed.netty.NettyWsSessionFactory;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the OKX perpetual feed.
 */
public class PerpetualFeedApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(PerpetualFeedApp.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   OKX Perpetual Feed Starting...");
        LOGGER.info("========================================");

        try {
            FeedConfig config = FeedConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Domain: {}", config.domain());
            LOGGER.info("  REST: {}", config.restBaseUrl());
            LOGGER.info("  WS: {}", config.publicWsUrl());
            LOGGER.info("  Pairs: {}", config.tradingPairs());

            FeedMetrics metrics = new FeedMetrics();
            OkxRequestSigner signer = config.credentials().map(OkxRequestSigner::new).orElse(null);
            OkHttpRestClient restClient = new OkHttpRestClient(
                new ObjectMapper(), signer, config.domain().isSimulatedTrading());

            ShutdownSignalBarrier shutdownBarrier = new ShutdownSignalBarrier();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            try (NettyWsSessionFactory sessionFactory = new NettyWsSessionFactory();
                 OkxPerpetualDataSource dataSource = new OkxPerpetualDataSource(
                     config, restClient, sessionFactory, new OkxSwapSymbolTranslator(), metrics);
                 MetricsServer metricsServer = new MetricsServer(
                     config.metricsPort(), metrics, dataSource::getConnectionState, dataSource.queues())) {

                metricsServer.start();
                dataSource.start();

                shutdownBarrier.await();
                dataSource.stop();
            }
        } catch (Exception e) {
            LOGGER.error("Fatal error in OKX Perpetual Feed", e);
            System.exit(1);
        }

        LOGGER.info("OKX Perpetual Feed exited");
    }
}
