package com.tradecore.position;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.tradecore.exchange.ExchangeErrors;
import com.tradecore.exchange.ExchangeGateway;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Periodically audits the {@link PositionStore} against the exchange's position list. When the
 * exchange cannot be reached the local state is cleared instead of being trusted.
 */
@Component
public class ReconciliationLoop {

	private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationLoop.class);

	private final ExchangeGateway exchangeGateway;
	private final PositionStore positionStore;
	private final AtomicBoolean enabled = new AtomicBoolean(false);
	private final AtomicBoolean inFlight = new AtomicBoolean(false);

	public ReconciliationLoop(ExchangeGateway exchangeGateway, PositionStore positionStore) {
		this.exchangeGateway = exchangeGateway;
		this.positionStore = positionStore;
	}

	/**
	 * Runs the startup pass and arms the periodic one.
	 */
	public Mono<ReconciliationReport> start() {
		return runOnce().doFinally(signal -> enabled.set(true));
	}

	@Scheduled(initialDelayString = "${trading.reconcile-interval-ms:60000}",
			fixedDelayString = "${trading.reconcile-interval-ms:60000}")
	public void scheduledRun() {
		if (!enabled.get()) {
			return;
		}
		runOnce().subscribe(null, error -> LOGGER.warn("EVENT=RECONCILE_SUBSCRIBE_FAIL reason={}",
				error.getMessage()));
	}

	public Mono<ReconciliationReport> runOnce() {
		if (!inFlight.compareAndSet(false, true)) {
			return Mono.empty();
		}
		return Mono.defer(() -> {
			long observedAt = System.currentTimeMillis();
			return exchangeGateway.getOpenPositions()
					.map(exchangePositions -> positionStore.reconcile(exchangePositions, observedAt));
		})
				.flatMap(report -> cancelOrphanedOrders(report).thenReturn(report))
				.doOnNext(report -> LOGGER.info(
						"EVENT=RECONCILE_DONE tracked={} stale={} sideMismatch={} qtyCorrected={} untracked={}",
						positionStore.count(), report.staleDropped(), report.sideMismatchDropped(),
						report.quantityCorrected(), report.untrackedOnExchange()))
				.onErrorResume(error -> {
					LOGGER.error("EVENT=RECONCILE_FAIL action=clear_local_state reason={}",
							ExchangeErrors.describe(error));
					positionStore.clear();
					return Mono.just(ReconciliationReport.empty());
				})
				.doFinally(signal -> inFlight.set(false));
	}

	// Brackets of a position that vanished on the exchange would otherwise stay on the book.
	private Mono<Void> cancelOrphanedOrders(ReconciliationReport report) {
		return Flux.fromIterable(report.droppedSymbols())
				.concatMap(symbol -> exchangeGateway.cancelAllOpenOrders(symbol)
						.retryWhen(Retry.backoff(2, Duration.ofMillis(200)).filter(ExchangeErrors::isTransient))
						.doOnSuccess(ignored -> LOGGER.info("EVENT=RECONCILE_ORDERS_CANCELLED symbol={}", symbol))
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=RECONCILE_CANCEL_FAIL symbol={} reason={}", symbol,
									ExchangeErrors.describe(error));
							return Mono.empty();
						}))
				.then();
	}
}
