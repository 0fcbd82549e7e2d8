package com.tradecore.market;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecore.config.BinanceProperties;
import com.tradecore.config.TradingProperties;
import com.tradecore.exchange.ExchangeGateway;
import com.tradecore.market.dto.DepthUpdateEvent;
import com.tradecore.market.dto.OrderBookDepthResponse;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Subscribes to the combined diff-depth stream of every traded symbol, feeds the
 * synchronizers, fetches snapshots on demand and publishes book-update signals.
 */
@Component
public class DepthStreamWatcher {

	private static final Logger LOGGER = LoggerFactory.getLogger(DepthStreamWatcher.class);
	private static final Duration SNAPSHOT_REFETCH_DELAY = Duration.ofMillis(500);

	private final BinanceProperties binanceProperties;
	private final TradingProperties tradingProperties;
	private final ExchangeGateway exchangeGateway;
	private final OrderBookRegistry registry;
	private final ObjectMapper objectMapper;
	private final ReactorNettyWebSocketClient webSocketClient = new ReactorNettyWebSocketClient();
	private final Map<String, AtomicBoolean> snapshotInFlight = new ConcurrentHashMap<>();

	private volatile Disposable connection;

	public DepthStreamWatcher(BinanceProperties binanceProperties,
			TradingProperties tradingProperties,
			ExchangeGateway exchangeGateway,
			OrderBookRegistry registry,
			ObjectMapper objectMapper) {
		this.binanceProperties = binanceProperties;
		this.tradingProperties = tradingProperties;
		this.exchangeGateway = exchangeGateway;
		this.registry = registry;
		this.objectMapper = objectMapper;
		registry.symbols().forEach(symbol -> snapshotInFlight.put(symbol, new AtomicBoolean(false)));
	}

	public void start() {
		if (registry.symbols().isEmpty()) {
			LOGGER.warn("EVENT=DEPTH_STREAM_SKIPPED reason=no_traded_symbols");
			return;
		}
		URI uri = streamUri();
		LOGGER.info("EVENT=DEPTH_STREAM_START uri={}", uri);
		connection = webSocketClient.execute(uri, session -> session.receive()
				.map(message -> message.getPayloadAsText())
				.doOnNext(this::handleMessage)
				.then())
				.doOnError(error -> LOGGER.warn("EVENT=DEPTH_STREAM_DISCONNECTED reason={}", error.getMessage()))
				.doOnTerminate(this::resetBooks)
				.retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1)).maxBackoff(Duration.ofSeconds(30)))
				.repeatWhen(completed -> completed.delayElements(Duration.ofSeconds(1)))
				.subscribe();
	}

	@PreDestroy
	public void stop() {
		Disposable current = connection;
		if (current != null) {
			current.dispose();
		}
	}

	private void resetBooks() {
		registry.symbols().forEach(symbol -> registry.synchronizer(symbol).reset());
	}

	URI streamUri() {
		String streams = registry.symbols().stream()
				.map(symbol -> symbol.toLowerCase(Locale.ROOT) + "@depth@100ms")
				.collect(Collectors.joining("/"));
		return URI.create(binanceProperties.resolvedStreamBaseUrl() + "/stream?streams=" + streams);
	}

	void handleMessage(String payload) {
		DepthUpdateEvent event;
		try {
			JsonNode root = objectMapper.readTree(payload);
			JsonNode data = root.has("data") ? root.get("data") : root;
			event = objectMapper.treeToValue(data, DepthUpdateEvent.class);
		} catch (Exception ex) {
			LOGGER.warn("EVENT=DEPTH_PARSE_FAIL reason={}", ex.getMessage());
			return;
		}
		if (event == null || !registry.isTraded(event.symbol())) {
			return;
		}
		handleDepthUpdate(event);
	}

	void handleDepthUpdate(DepthUpdateEvent event) {
		String symbol = event.symbol().toUpperCase(Locale.ROOT);
		OrderBookSynchronizer synchronizer = registry.synchronizer(symbol);
		DiffOutcome outcome = synchronizer.applyDiff(event);
		if (outcome == DiffOutcome.APPLIED) {
			registry.signal(symbol).publish(event.finalUpdateId());
			return;
		}
		if (outcome.requiresSnapshot() || outcome == DiffOutcome.BUFFERED) {
			requestSnapshot(symbol, Duration.ZERO);
		}
	}

	void requestSnapshot(String symbol, Duration delay) {
		AtomicBoolean inFlight = snapshotInFlight.get(symbol);
		if (!inFlight.compareAndSet(false, true)) {
			return;
		}
		Mono.delay(delay)
				.then(exchangeGateway.getOrderBookSnapshot(symbol, tradingProperties.snapshotDepth()))
				.subscribe(snapshot -> onSnapshot(symbol, snapshot),
						error -> {
							LOGGER.warn("EVENT=DEPTH_SNAPSHOT_FAIL symbol={} reason={}", symbol, error.getMessage());
							inFlight.set(false);
						});
	}

	void onSnapshot(String symbol, OrderBookDepthResponse snapshot) {
		OrderBookSynchronizer synchronizer = registry.synchronizer(symbol);
		SnapshotOutcome outcome = synchronizer.applySnapshot(snapshot);
		snapshotInFlight.get(symbol).set(false);
		if (outcome == SnapshotOutcome.SYNCED) {
			registry.signal(symbol).publish(synchronizer.lastUpdateId());
			return;
		}
		requestSnapshot(symbol, SNAPSHOT_REFETCH_DELAY);
	}
}
