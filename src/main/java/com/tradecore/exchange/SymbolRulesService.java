package com.tradecore.exchange;

import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.tradecore.exchange.dto.SymbolRules;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Cache of price/quantity precision rules for the traded symbols, refreshed periodically.
 */
@Component
public class SymbolRulesService {

	private static final Logger LOGGER = LoggerFactory.getLogger(SymbolRulesService.class);
	private static final Duration RETRY_MIN_BACKOFF = Duration.ofSeconds(2);
	private static final Duration RETRY_MAX_BACKOFF = Duration.ofSeconds(30);

	private final ExchangeGateway exchangeGateway;
	private final Map<String, SymbolRules> cache = new ConcurrentHashMap<>();
	private final Set<String> trackedSymbols = ConcurrentHashMap.newKeySet();
	private final AtomicBoolean refreshInFlight = new AtomicBoolean(false);

	public SymbolRulesService(ExchangeGateway exchangeGateway) {
		this.exchangeGateway = exchangeGateway;
	}

	public Mono<Void> preload(Collection<String> symbols) {
		trackedSymbols.clear();
		symbols.forEach(symbol -> trackedSymbols.add(normalizeSymbol(symbol)));
		return refreshAll();
	}

	public SymbolRules getRules(String symbol) {
		return cache.get(normalizeSymbol(symbol));
	}

	/**
	 * Cached rules when present, otherwise a one-off fetch that also fills the cache.
	 */
	public Mono<SymbolRules> resolveRules(String symbol) {
		SymbolRules cached = getRules(symbol);
		if (cached != null) {
			return Mono.just(cached);
		}
		return exchangeGateway.getSymbolRules(normalizeSymbol(symbol))
				.doOnNext(rules -> cache.put(normalizeSymbol(symbol), rules));
	}

	@Scheduled(initialDelayString = "${trading.rules-refresh-interval-ms:3600000}",
			fixedDelayString = "${trading.rules-refresh-interval-ms:3600000}")
	public void scheduledRefresh() {
		refreshAll().subscribe(null, error -> LOGGER.warn("EVENT=RULES_REFRESH_SUBSCRIBE_FAIL reason={}",
				error.getMessage()));
	}

	Mono<Void> refreshAll() {
		if (trackedSymbols.isEmpty() || !refreshInFlight.compareAndSet(false, true)) {
			return Mono.empty();
		}
		return Flux.fromIterable(Set.copyOf(trackedSymbols))
				.concatMap(symbol -> exchangeGateway.getSymbolRules(symbol)
						.retryWhen(Retry.backoff(4, RETRY_MIN_BACKOFF)
								.maxBackoff(RETRY_MAX_BACKOFF)
								.jitter(0.2)
								.filter(ExchangeErrors::isTransient))
						.doOnNext(rules -> {
							cache.put(symbol, rules);
							LOGGER.info("EVENT=RULES_READY_FOR_SYMBOL symbol={} priceTick={} quantityStep={} pricePrecision={} quantityPrecision={}",
									symbol,
									rules.priceTick(),
									rules.quantityStep(),
									rules.pricePrecision(),
									rules.quantityPrecision());
						})
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=RULES_FAIL symbol={} reason={}", symbol, error.getMessage());
							return Mono.empty();
						}))
				.doFinally(signal -> refreshInFlight.set(false))
				.then();
	}

	private static String normalizeSymbol(String symbol) {
		return symbol == null ? null : symbol.toUpperCase(Locale.ROOT);
	}
}
