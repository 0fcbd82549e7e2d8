package com.tradecore.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.tradecore.config.BinanceProperties;
import com.tradecore.config.TradingProperties;
import com.tradecore.exchange.ExchangeErrors;
import com.tradecore.exchange.ExchangeGateway;
import com.tradecore.exchange.SymbolRulesService;
import com.tradecore.exchange.UserDataStreamWatcher;
import com.tradecore.market.DepthStreamWatcher;
import com.tradecore.market.OrderBookRegistry;
import com.tradecore.position.PositionStore;
import com.tradecore.position.ReconciliationLoop;
import com.tradecore.strategy.Strategy;
import com.tradecore.strategy.StrategyRegistry;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Startup sequence: account setup per symbol, symbol rules, startup reconciliation, streams,
 * then one monitor per strategy. Symbols whose margin or leverage setup fails are not traded.
 */
@Component
public class TradingBootstrap {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingBootstrap.class);

	private final BinanceProperties binanceProperties;
	private final TradingProperties tradingProperties;
	private final ExchangeGateway exchangeGateway;
	private final SymbolRulesService symbolRulesService;
	private final ReconciliationLoop reconciliationLoop;
	private final DepthStreamWatcher depthStreamWatcher;
	private final UserDataStreamWatcher userDataStreamWatcher;
	private final OrderBookRegistry orderBookRegistry;
	private final StrategyRegistry strategyRegistry;
	private final PositionStore positionStore;
	private final PendingSymbolTable pendingSymbols;
	private final OrderLifecycleCoordinator coordinator;
	private final List<Disposable> running = new CopyOnWriteArrayList<>();

	public TradingBootstrap(BinanceProperties binanceProperties,
			TradingProperties tradingProperties,
			ExchangeGateway exchangeGateway,
			SymbolRulesService symbolRulesService,
			ReconciliationLoop reconciliationLoop,
			DepthStreamWatcher depthStreamWatcher,
			UserDataStreamWatcher userDataStreamWatcher,
			OrderBookRegistry orderBookRegistry,
			StrategyRegistry strategyRegistry,
			PositionStore positionStore,
			PendingSymbolTable pendingSymbols,
			OrderLifecycleCoordinator coordinator) {
		this.binanceProperties = binanceProperties;
		this.tradingProperties = tradingProperties;
		this.exchangeGateway = exchangeGateway;
		this.symbolRulesService = symbolRulesService;
		this.reconciliationLoop = reconciliationLoop;
		this.depthStreamWatcher = depthStreamWatcher;
		this.userDataStreamWatcher = userDataStreamWatcher;
		this.orderBookRegistry = orderBookRegistry;
		this.strategyRegistry = strategyRegistry;
		this.positionStore = positionStore;
		this.pendingSymbols = pendingSymbols;
		this.coordinator = coordinator;
	}

	@EventListener(ApplicationReadyEvent.class)
	public void onReady() {
		List<String> symbols = tradingProperties.tradedSymbols();
		if (symbols.isEmpty()) {
			LOGGER.warn("EVENT=BOOTSTRAP_IDLE reason=no_strategies_configured");
			return;
		}
		if (!binanceProperties.hasCredentials()) {
			LOGGER.warn("EVENT=TRADING_DISABLED reason=missing_credentials action=market_data_only");
			depthStreamWatcher.start();
			return;
		}
		setUpAccount(symbols)
				.flatMap(ready -> symbolRulesService.preload(ready)
						.then(reconciliationLoop.start())
						.then(Mono.just(ready)))
				.subscribe(this::startTrading,
						error -> LOGGER.error("EVENT=BOOTSTRAP_FAIL reason={}", ExchangeErrors.describe(error)));
	}

	Mono<List<String>> setUpAccount(List<String> symbols) {
		return Flux.fromIterable(symbols)
				.concatMap(symbol -> exchangeGateway.changeMarginType(symbol, tradingProperties.marginType())
						.then(exchangeGateway.changeLeverage(symbol, tradingProperties.leverage()))
						.thenReturn(symbol)
						.doOnNext(ready -> LOGGER.info("EVENT=SYMBOL_SETUP_OK symbol={} leverage={} marginType={}",
								ready, tradingProperties.leverage(), tradingProperties.marginType()))
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=SYMBOL_SETUP_FAIL symbol={} action=skip reason={}", symbol,
									ExchangeErrors.describe(error));
							return Mono.empty();
						}))
				.collectList();
	}

	void startTrading(List<String> readySymbols) {
		depthStreamWatcher.start();
		userDataStreamWatcher.start();
		running.add(coordinator.subscribe(userDataStreamWatcher.orderUpdates()));
		Set<String> ready = Set.copyOf(readySymbols);
		List<String> started = new ArrayList<>();
		for (Strategy strategy : strategyRegistry.all()) {
			String symbol = strategy.symbol();
			if (!ready.contains(symbol) || !orderBookRegistry.isTraded(symbol)) {
				LOGGER.warn("EVENT=MONITOR_SKIPPED strategy={} symbol={} reason=symbol_not_ready", strategy.id(),
						symbol);
				continue;
			}
			SymbolMonitor monitor = new SymbolMonitor(strategy,
					orderBookRegistry.synchronizer(symbol),
					orderBookRegistry.signal(symbol),
					positionStore,
					pendingSymbols,
					coordinator,
					tradingProperties.viewDepth());
			running.add(monitor.start());
			started.add(strategy.id());
		}
		LOGGER.info("EVENT=TRADING_STARTED symbols={} strategies={} openPositions={}", readySymbols, started,
				positionStore.count());
	}

	@PreDestroy
	public void stop() {
		running.forEach(Disposable::dispose);
		running.clear();
	}
}
