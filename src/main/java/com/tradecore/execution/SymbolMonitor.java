package com.tradecore.execution;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tradecore.market.BookUpdateSignal;
import com.tradecore.market.OrderBookSynchronizer;
import com.tradecore.market.OrderBookView;
import com.tradecore.position.Position;
import com.tradecore.position.PositionStore;
import com.tradecore.strategy.Strategy;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Runs one strategy against its symbol's book. Each book update triggers a tick: with a
 * position open the strategy may adjust or close it, otherwise it may emit an entry signal.
 * Only the latest update is kept while a tick is running, and a failed tick never stops the loop.
 */
public class SymbolMonitor {

	private static final Logger LOGGER = LoggerFactory.getLogger(SymbolMonitor.class);

	private final Strategy strategy;
	private final OrderBookSynchronizer synchronizer;
	private final BookUpdateSignal updateSignal;
	private final PositionStore positionStore;
	private final PendingSymbolTable pendingSymbols;
	private final OrderLifecycleCoordinator coordinator;
	private final int viewDepth;

	public SymbolMonitor(Strategy strategy,
			OrderBookSynchronizer synchronizer,
			BookUpdateSignal updateSignal,
			PositionStore positionStore,
			PendingSymbolTable pendingSymbols,
			OrderLifecycleCoordinator coordinator,
			int viewDepth) {
		this.strategy = strategy;
		this.synchronizer = synchronizer;
		this.updateSignal = updateSignal;
		this.positionStore = positionStore;
		this.pendingSymbols = pendingSymbols;
		this.coordinator = coordinator;
		this.viewDepth = viewDepth;
	}

	public Disposable start() {
		LOGGER.info("EVENT=MONITOR_START strategy={} symbol={}", strategy.id(), strategy.symbol());
		return updateSignal.updates()
				.onBackpressureLatest()
				.concatMap(updateId -> tick(), 1)
				.subscribe(null, error -> LOGGER.error("EVENT=MONITOR_STOPPED strategy={} reason={}", strategy.id(),
						error.getMessage()));
	}

	Mono<Void> tick() {
		return Mono.defer(this::evaluate)
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=MONITOR_TICK_FAIL strategy={} symbol={} reason={}", strategy.id(),
							strategy.symbol(), error.getMessage());
					return Mono.empty();
				});
	}

	private Mono<Void> evaluate() {
		Optional<OrderBookView> view = synchronizer.getDepth(viewDepth);
		if (view.isEmpty()) {
			return Mono.empty();
		}
		Optional<Position> position = positionStore.get(strategy.symbol());
		if (position.isPresent()) {
			Position open = position.get();
			if (open.strategyId() != null && !open.strategyId().equals(strategy.id())) {
				return Mono.empty();
			}
			if (pendingSymbols.isPending(strategy.symbol())) {
				return Mono.empty();
			}
			return strategy.analyzeAndAdjust(open, view.get())
					.map(command -> coordinator.onAdjustment(strategy, open, command))
					.orElse(Mono.empty());
		}
		if (pendingSymbols.isPending(strategy.symbol())) {
			return Mono.empty();
		}
		return strategy.checkSignal(view.get())
				.map(signal -> coordinator.onSignal(strategy, signal, view.get()))
				.orElse(Mono.empty());
	}
}
