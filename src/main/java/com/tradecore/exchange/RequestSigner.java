package com.tradecore.exchange;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.tradecore.config.BinanceProperties;

import reactor.core.publisher.Mono;

/**
 * Builds the query string of a USER_DATA / TRADE request: caller parameters, receive window,
 * a timestamp on the exchange's clock and the HMAC-SHA256 signature over all of it.
 * <p>
 * The local clock is corrected by an offset measured against {@code /fapi/v1/time}, refreshed
 * every minute and on demand after a -1021 rejection.
 */
@Component
public class RequestSigner {

	private static final Logger LOGGER = LoggerFactory.getLogger(RequestSigner.class);
	private static final String HMAC_SHA256 = "HmacSHA256";
	private static final long DEFAULT_RECV_WINDOW_MS = 10_000L;
	private static final long CLOCK_RESYNC_INTERVAL_MS = 60_000L;

	private final WebClient binanceWebClient;
	private final BinanceProperties properties;
	private final AtomicLong clockOffsetMs = new AtomicLong();
	private final AtomicReference<Mono<Long>> resyncInFlight = new AtomicReference<>();

	public RequestSigner(WebClient binanceWebClient, BinanceProperties properties) {
		this.binanceWebClient = binanceWebClient;
		this.properties = properties;
	}

	public String signedQuery(String params) {
		long recvWindow = properties.recvWindowMillis() > 0 ? properties.recvWindowMillis() : DEFAULT_RECV_WINDOW_MS;
		String payload = (params.isEmpty() ? "" : params + "&")
				+ "recvWindow=" + recvWindow
				+ "&timestamp=" + exchangeTimeMillis();
		return payload + "&signature=" + hmacSha256Hex(payload, properties.secretKey());
	}

	long exchangeTimeMillis() {
		return System.currentTimeMillis() + clockOffsetMs.get();
	}

	static String hmacSha256Hex(String payload, String secretKey) {
		try {
			Mac mac = Mac.getInstance(HMAC_SHA256);
			mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
			return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
		} catch (GeneralSecurityException ex) {
			throw new IllegalStateException("HMAC-SHA256 signing unavailable", ex);
		}
	}

	/**
	 * Re-measures the clock offset. Concurrent callers share one request; a failed measurement
	 * keeps the previous offset.
	 */
	public Mono<Long> resync() {
		Mono<Long> running = resyncInFlight.get();
		if (running != null) {
			return running;
		}
		long previous = clockOffsetMs.get();
		Mono<Long> measurement = binanceWebClient
				.get()
				.uri("/fapi/v1/time")
				.retrieve()
				.bodyToMono(ServerTime.class)
				.map(serverTime -> {
					long offset = serverTime.serverTime() - System.currentTimeMillis();
					clockOffsetMs.set(offset);
					if (Math.abs(offset - previous) > 1_000L) {
						LOGGER.info("EVENT=CLOCK_OFFSET_CHANGED previousMs={} offsetMs={}", previous, offset);
					}
					return offset;
				})
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=CLOCK_RESYNC_FAIL keepOffsetMs={} reason={}", previous,
							ExchangeErrors.describe(error));
					return Mono.just(previous);
				})
				.doFinally(signal -> resyncInFlight.set(null))
				.cache();
		return resyncInFlight.compareAndSet(null, measurement) ? measurement : resyncInFlight.get();
	}

	@Scheduled(initialDelay = 0, fixedDelay = CLOCK_RESYNC_INTERVAL_MS)
	void scheduledResync() {
		resync().subscribe();
	}

	private record ServerTime(long serverTime) {
	}
}
