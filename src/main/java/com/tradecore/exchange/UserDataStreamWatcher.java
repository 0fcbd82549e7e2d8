package com.tradecore.exchange;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecore.config.BinanceProperties;
import com.tradecore.exchange.dto.OrderUpdateEvent;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

/**
 * Keeps the user-data stream open (listen key, keepalive, reconnect) and republishes
 * {@code ORDER_TRADE_UPDATE} messages as {@link OrderUpdateEvent}s.
 */
@Component
public class UserDataStreamWatcher {

	private static final Logger LOGGER = LoggerFactory.getLogger(UserDataStreamWatcher.class);
	private static final Duration LISTEN_KEY_KEEPALIVE = Duration.ofMinutes(30);

	private final ExchangeGateway exchangeGateway;
	private final BinanceProperties properties;
	private final ObjectMapper objectMapper;
	private final ReactorNettyWebSocketClient webSocketClient = new ReactorNettyWebSocketClient();
	private final Sinks.Many<OrderUpdateEvent> updates = Sinks.many().multicast().onBackpressureBuffer();
	private final AtomicReference<Disposable> socketSubscription = new AtomicReference<>();
	private final AtomicReference<Disposable> keepAliveSubscription = new AtomicReference<>();
	private final AtomicReference<String> listenKeyRef = new AtomicReference<>();

	public UserDataStreamWatcher(ExchangeGateway exchangeGateway, BinanceProperties properties,
			ObjectMapper objectMapper) {
		this.exchangeGateway = exchangeGateway;
		this.properties = properties;
		this.objectMapper = objectMapper;
	}

	public Flux<OrderUpdateEvent> orderUpdates() {
		return updates.asFlux();
	}

	public void start() {
		openStream();
		Disposable keepAlive = Flux.interval(LISTEN_KEY_KEEPALIVE)
				.concatMap(ignored -> {
					String listenKey = listenKeyRef.get();
					if (listenKey == null) {
						return Mono.empty();
					}
					return exchangeGateway.keepAliveUserDataStream(listenKey)
							.doOnError(error -> LOGGER.warn("EVENT=USER_STREAM_KEEPALIVE_FAIL reason={}",
									error.getMessage()))
							.onErrorResume(error -> Mono.empty());
				})
				.subscribe();
		replace(keepAliveSubscription, keepAlive);
	}

	@PreDestroy
	public void stop() {
		replace(socketSubscription, null);
		replace(keepAliveSubscription, null);
	}

	private void openStream() {
		exchangeGateway.startUserDataStream()
				.doOnError(error -> LOGGER.warn("EVENT=USER_STREAM_LISTEN_KEY_FAIL reason={}", error.getMessage()))
				.retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(2)).maxBackoff(Duration.ofMinutes(1)))
				.subscribe(listenKey -> {
					listenKeyRef.set(listenKey);
					replace(socketSubscription, connect(listenKey));
					LOGGER.info("EVENT=USER_STREAM_CONNECTING");
				});
	}

	private Disposable connect(String listenKey) {
		URI uri = URI.create(properties.resolvedStreamBaseUrl() + "/ws/" + listenKey);
		return webSocketClient.execute(uri, session -> session.receive()
				.map(message -> message.getPayloadAsText())
				.doOnNext(this::handleMessage)
				.then())
				.doOnError(error -> LOGGER.warn("EVENT=USER_STREAM_DISCONNECTED reason={}", error.getMessage()))
				.retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1)).maxBackoff(Duration.ofSeconds(30)))
				.repeatWhen(completed -> completed.delayElements(Duration.ofSeconds(1)))
				.subscribe();
	}

	void handleMessage(String payload) {
		JsonNode node;
		try {
			node = objectMapper.readTree(payload);
		} catch (Exception ex) {
			LOGGER.warn("EVENT=USER_STREAM_PARSE_FAIL error={}", ex.getMessage());
			return;
		}
		String eventType = node.path("e").asText();
		if ("listenKeyExpired".equals(eventType)) {
			LOGGER.warn("EVENT=USER_STREAM_LISTEN_KEY_EXPIRED action=reconnect");
			listenKeyRef.set(null);
			replace(socketSubscription, null);
			openStream();
			return;
		}
		if (!"ORDER_TRADE_UPDATE".equals(eventType)) {
			return;
		}
		OrderUpdateEvent update = parseOrderUpdate(node);
		LOGGER.info("EVENT=ORDER_UPDATE symbol={} orderId={} clientOrderId={} status={} type={} avgPrice={} filledQty={} reduceOnly={}",
				update.symbol(), update.orderId(), update.clientOrderId(), update.status(), update.orderType(),
				update.avgFillPrice(), update.filledQuantity(), update.reduceOnly());
		Sinks.EmitResult result = updates.tryEmitNext(update);
		if (result.isFailure()) {
			LOGGER.warn("EVENT=ORDER_UPDATE_DROPPED symbol={} orderId={} result={}", update.symbol(),
					update.orderId(), result);
		}
	}

	static OrderUpdateEvent parseOrderUpdate(JsonNode node) {
		JsonNode order = node.path("o");
		String originalType = order.path("ot").asText("");
		return new OrderUpdateEvent(
				order.path("s").asText(),
				order.path("i").asLong(),
				order.path("c").asText(),
				order.path("X").asText(),
				originalType.isEmpty() ? order.path("o").asText() : originalType,
				decimal(order.path("ap")),
				decimal(order.path("z")),
				order.path("R").asBoolean(false),
				node.path("E").asLong(order.path("T").asLong()));
	}

	private static BigDecimal decimal(JsonNode node) {
		String text = node.asText("");
		if (text.isEmpty()) {
			return BigDecimal.ZERO;
		}
		return new BigDecimal(text);
	}

	private static void replace(AtomicReference<Disposable> ref, Disposable next) {
		Disposable previous = ref.getAndSet(next);
		if (previous != null) {
			previous.dispose();
		}
	}
}
