package in.tradecore.infrastructure.broker.data;

import in.tradecore.domain.data.Tick;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Streaming market data source.
 *
 * Failures are surfaced as {@link FeedDisconnectedException} and {@link FeedTimeoutException},
 * either through the returned futures or through the disconnect listener.
 */
public interface MarketFeed {

    /**
     * Connect to the feed.
     *
     * @return Future that completes when connected
     */
    CompletableFuture<Void> connect();

    void disconnect();

    boolean isConnected();

    /**
     * Subscribe to ticks for the given symbols, in the given order.
     */
    CompletableFuture<Void> subscribe(List<String> symbols);

    /**
     * Register tick listener. Called on the feed's own thread.
     */
    void onTick(Consumer<Tick> listener);

    /**
     * Register listener for unexpected connection loss.
     */
    void onDisconnect(Consumer<Throwable> listener);

    /**
     * Short identifier used in logs and exception messages.
     */
    String getFeedCode();
}
