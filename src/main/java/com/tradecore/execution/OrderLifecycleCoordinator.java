package com.tradecore.execution;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.tradecore.config.TradingProperties;
import com.tradecore.exchange.ExchangeErrors;
import com.tradecore.exchange.ExchangeGateway;
import com.tradecore.exchange.SymbolRulesService;
import com.tradecore.exchange.dto.OrderRequest;
import com.tradecore.exchange.dto.OrderResponse;
import com.tradecore.exchange.dto.OrderSide;
import com.tradecore.exchange.dto.OrderType;
import com.tradecore.exchange.dto.OrderUpdateEvent;
import com.tradecore.exchange.dto.SymbolRules;
import com.tradecore.market.OrderBookRegistry;
import com.tradecore.market.OrderBookView;
import com.tradecore.position.Position;
import com.tradecore.position.PositionSide;
import com.tradecore.position.PositionStore;
import com.tradecore.strategy.AdjustmentCommand;
import com.tradecore.strategy.Signal;
import com.tradecore.strategy.StopLossTakeProfit;
import com.tradecore.strategy.Strategy;
import com.tradecore.strategy.StrategyRegistry;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Drives each symbol through entry, protection and exit.
 * <p>
 * Idle symbols accept a signal: the entry order is sized and submitted and the symbol is marked
 * pending. When the entry fills, stop-loss and take-profit orders are computed from the actual
 * fill price and placed together; the position is stored only once both exist. If either
 * bracket fails, the one that succeeded is cancelled and the fill is flattened with a
 * reduce-only market order. A filled bracket cancels its sibling and closes the position.
 * Adjustments place the new pair before cancelling the old one, so a position is never left
 * without a stop.
 * <p>
 * Every returned {@link Mono} completes normally; failures are logged where they happen.
 */
@Component
public class OrderLifecycleCoordinator {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderLifecycleCoordinator.class);
	private static final Retry TRANSIENT_RETRY = Retry.backoff(2, Duration.ofMillis(200))
			.filter(ExchangeErrors::isTransient);

	private final ExchangeGateway exchangeGateway;
	private final PositionStore positionStore;
	private final PendingSymbolTable pendingSymbols;
	private final PendingEntryBook pendingEntries;
	private final SymbolRulesService symbolRulesService;
	private final StrategyRegistry strategyRegistry;
	private final OrderBookRegistry orderBookRegistry;
	private final TradingProperties tradingProperties;

	public OrderLifecycleCoordinator(ExchangeGateway exchangeGateway,
			PositionStore positionStore,
			PendingSymbolTable pendingSymbols,
			PendingEntryBook pendingEntries,
			SymbolRulesService symbolRulesService,
			StrategyRegistry strategyRegistry,
			OrderBookRegistry orderBookRegistry,
			TradingProperties tradingProperties) {
		this.exchangeGateway = exchangeGateway;
		this.positionStore = positionStore;
		this.pendingSymbols = pendingSymbols;
		this.pendingEntries = pendingEntries;
		this.symbolRulesService = symbolRulesService;
		this.strategyRegistry = strategyRegistry;
		this.orderBookRegistry = orderBookRegistry;
		this.tradingProperties = tradingProperties;
	}

	/**
	 * Consumes order updates, one symbol at a time in arrival order; different symbols run
	 * independently.
	 */
	public Disposable subscribe(Flux<OrderUpdateEvent> updates) {
		return updates
				.groupBy(OrderUpdateEvent::symbol)
				.flatMap(group -> group.concatMap(this::onOrderUpdate))
				.subscribe(null, error -> LOGGER.error("EVENT=ORDER_UPDATE_PIPELINE_FAIL reason={}",
						error.getMessage()));
	}

	// ---- entry ----

	public Mono<Void> onSignal(Strategy strategy, Signal signal, OrderBookView view) {
		String symbol = strategy.symbol();
		if (positionStore.contains(symbol)) {
			return Mono.empty();
		}
		PendingSymbolTable.EntryClaim claim = pendingSymbols.tryAcquireEntry(symbol, positionStore::count,
				tradingProperties.maxActiveTrades());
		if (claim == PendingSymbolTable.EntryClaim.AT_CAPACITY) {
			LOGGER.info("EVENT=ENTRY_SKIPPED symbol={} reason=max_active_trades max={}", symbol,
					tradingProperties.maxActiveTrades());
		}
		if (claim != PendingSymbolTable.EntryClaim.CLAIMED) {
			return Mono.empty();
		}
		return Mono.defer(() -> submitEntry(strategy, signal, view))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=ENTRY_FAIL symbol={} strategy={} reason={}", symbol, strategy.id(),
							ExchangeErrors.describe(error));
					pendingEntries.findBySymbol(symbol)
							.ifPresent(entry -> pendingEntries.remove(entry.clientOrderId()));
					pendingSymbols.release(symbol);
					return Mono.empty();
				});
	}

	private Mono<Void> submitEntry(Strategy strategy, Signal signal, OrderBookView view) {
		String symbol = strategy.symbol();
		return Mono.zip(symbolRulesService.resolveRules(symbol),
				exchangeGateway.getAccountBalance(tradingProperties.balanceAsset()))
				.flatMap(tuple -> {
					SymbolRules rules = tuple.getT1();
					BigDecimal balance = tuple.getT2();
					PositionSide side = PositionSide.fromEntrySide(signal.side());
					OrderType orderType = strategy.entryOrderType() == OrderType.MARKET ? OrderType.MARKET
							: OrderType.LIMIT;
					BigDecimal entryPrice = intendedEntryPrice(strategy, signal, view, rules, orderType);
					BigDecimal quantity = PositionSizer.quantity(balance, tradingProperties.marginPerTradePct(),
							tradingProperties.leverage(), entryPrice, rules);
					if (quantity.signum() == 0) {
						LOGGER.info("EVENT=ENTRY_ABORTED symbol={} reason=zero_quantity balance={} price={}", symbol,
								balance, entryPrice);
						pendingSymbols.release(symbol);
						return Mono.empty();
					}
					Optional<StopLossTakeProfit> estimated = roundedBrackets(strategy, entryPrice, side, view, rules);
					if (estimated.isEmpty()) {
						LOGGER.info("EVENT=ENTRY_ABORTED symbol={} reason=no_valid_brackets price={}", symbol,
								entryPrice);
						pendingSymbols.release(symbol);
						return Mono.empty();
					}

					String clientOrderId = ClientOrderIds.next("e");
					PendingEntry pending = new PendingEntry(clientOrderId, symbol, strategy.id(), signal.side(),
							orderType, quantity, entryPrice, estimated.get(), System.currentTimeMillis(), null, false);
					pendingEntries.add(pending);
					OrderRequest request = orderType == OrderType.MARKET
							? OrderRequest.market(symbol, signal.side(), quantity, clientOrderId)
							: OrderRequest.limit(symbol, signal.side(), quantity, entryPrice, clientOrderId);
					LOGGER.info("EVENT=ENTRY_SUBMIT symbol={} strategy={} side={} type={} qty={} price={} estSl={} estTp={} clientOrderId={}",
							symbol, strategy.id(), signal.side(), orderType, quantity, entryPrice,
							estimated.get().stopLoss(), estimated.get().takeProfit(), clientOrderId);
					return exchangeGateway.createOrder(request)
							.doOnNext(response -> pendingEntries.attachOrderId(clientOrderId, response.orderId()))
							.then();
				});
	}

	private static BigDecimal intendedEntryPrice(Strategy strategy, Signal signal, OrderBookView view,
			SymbolRules rules, OrderType orderType) {
		if (orderType == OrderType.LIMIT) {
			return PositionSizer.limitEntryPrice(signal.referencePrice(), signal.side(), strategy.entryOffsetTicks(),
					rules);
		}
		BigDecimal touch = null;
		if (view != null) {
			touch = signal.side() == OrderSide.BUY ? view.bestAsk() : view.bestBid();
		}
		return touch == null ? signal.referencePrice() : touch;
	}

	// ---- order updates ----

	public Mono<Void> onOrderUpdate(OrderUpdateEvent event) {
		return Mono.defer(() -> routeOrderUpdate(event))
				.onErrorResume(error -> {
					LOGGER.error("EVENT=ORDER_UPDATE_HANDLER_FAIL symbol={} orderId={} reason={}", event.symbol(),
							event.orderId(), ExchangeErrors.describe(error));
					return Mono.empty();
				});
	}

	private Mono<Void> routeOrderUpdate(OrderUpdateEvent event) {
		Optional<PendingEntry> pending = pendingEntries.findByClientOrderId(event.clientOrderId());
		if (pending.isPresent()) {
			return onEntryUpdate(pending.get(), event);
		}
		Optional<Position> position = positionStore.get(event.symbol());
		if (position.isPresent() && event.isFilled() && position.get().isBracketOrder(event.orderId())) {
			return onBracketFilled(position.get(), event);
		}
		return Mono.empty();
	}

	private Mono<Void> onEntryUpdate(PendingEntry pending, OrderUpdateEvent event) {
		if (event.isFilled()) {
			return pendingEntries.remove(pending.clientOrderId())
					.map(entry -> protectFill(entry, event.avgFillPrice(), event.filledQuantity()))
					.orElse(Mono.empty());
		}
		if (!event.isCanceledOrExpired()) {
			return Mono.empty();
		}
		Optional<PendingEntry> removed = pendingEntries.remove(pending.clientOrderId());
		if (removed.isEmpty()) {
			return Mono.empty();
		}
		if (event.hasFilledQuantity()) {
			LOGGER.warn("EVENT=ENTRY_PARTIAL_FILL_TERMINATED symbol={} status={} filledQty={} clientOrderId={}",
					pending.symbol(), event.status(), event.filledQuantity(), pending.clientOrderId());
			return protectFill(removed.get(), event.avgFillPrice(), event.filledQuantity());
		}
		LOGGER.info("EVENT=ENTRY_CANCELED symbol={} status={} clientOrderId={}", pending.symbol(), event.status(),
				pending.clientOrderId());
		pendingSymbols.release(pending.symbol());
		return Mono.empty();
	}

	/**
	 * Ends in one of two states: a stored position with both brackets on the exchange, or a
	 * flattened fill with a critical alert. The pending marker is released either way.
	 */
	Mono<Void> protectFill(PendingEntry entry, BigDecimal fillPrice, BigDecimal filledQuantity) {
		String symbol = entry.symbol();
		PositionSide side = PositionSide.fromEntrySide(entry.side());
		BigDecimal quantity = filledQuantity == null || filledQuantity.signum() <= 0 ? entry.quantity()
				: filledQuantity;
		BigDecimal entryPrice = fillPrice == null || fillPrice.signum() <= 0 ? entry.intendedPrice() : fillPrice;
		LOGGER.info("EVENT=ENTRY_FILLED symbol={} side={} qty={} fillPrice={} intendedPrice={}", symbol, side,
				quantity, entryPrice, entry.intendedPrice());

		return symbolRulesService.resolveRules(symbol)
				.flatMap(rules -> {
					Optional<StopLossTakeProfit> brackets = strategyRegistry.find(entry.strategyId())
							.flatMap(strategy -> roundedBrackets(strategy, entryPrice, side, currentView(symbol), rules));
					if (brackets.isEmpty()) {
						return Mono.error(new BracketProtectionException(symbol,
								"No valid brackets for fill price " + entryPrice, null));
					}
					StopLossTakeProfit levels = brackets.get();
					return placeBrackets(symbol, side, quantity, levels)
							.doOnNext(ids -> positionStore.set(new Position(symbol, side, quantity, entryPrice,
									levels.stopLoss(), levels.takeProfit(), levels.stopLoss(), ids.stopLossOrderId(),
									ids.takeProfitOrderId(), entry.strategyId(), System.currentTimeMillis())))
							.then();
				})
				.onErrorResume(error -> {
					CriticalAlerts.raise("BRACKET_PROTECTION_FAILED", symbol,
							"entry fill could not be protected, flattening qty=" + quantity, error);
					return flatten(symbol, side, quantity);
				})
				.doFinally(signal -> pendingSymbols.release(symbol));
	}

	private Mono<Void> flatten(String symbol, PositionSide side, BigDecimal quantity) {
		return exchangeGateway.createOrder(OrderRequest.reduceOnlyMarket(symbol, side.exitSide(), quantity))
				.retryWhen(TRANSIENT_RETRY)
				.doOnNext(response -> LOGGER.warn("EVENT=ROLLBACK_FLATTENED symbol={} qty={} orderId={}", symbol,
						quantity, response.orderId()))
				.onErrorResume(error -> {
					if (ExchangeErrors.isReduceOnlyRejected(error)) {
						LOGGER.warn("EVENT=ROLLBACK_ALREADY_FLAT symbol={}", symbol);
					} else {
						CriticalAlerts.raise("ROLLBACK_FAILED", symbol,
								"position may be open without protection, manual action required qty=" + quantity,
								error);
					}
					return Mono.empty();
				})
				.then();
	}

	private Mono<Void> onBracketFilled(Position position, OrderUpdateEvent event) {
		String symbol = position.symbol();
		Long sibling = position.siblingOf(event.orderId());
		LOGGER.info("EVENT=BRACKET_FILLED symbol={} orderId={} type={} avgPrice={} siblingOrderId={}", symbol,
				event.orderId(), event.orderType(), event.avgFillPrice(), sibling);
		return cancelSibling(symbol, sibling)
				.then(Mono.fromRunnable(() -> positionStore.get(symbol)
						.filter(current -> current.isBracketOrder(event.orderId()))
						.ifPresent(current -> positionStore.close(symbol))));
	}

	/**
	 * Cancels the remaining bracket. If that fails for any reason other than the order being
	 * gone, every open order of the symbol is cancelled instead; the position is closed either way.
	 */
	private Mono<Void> cancelSibling(String symbol, Long siblingOrderId) {
		if (siblingOrderId == null) {
			return Mono.empty();
		}
		return exchangeGateway.cancelOrder(symbol, siblingOrderId)
				.retryWhen(TRANSIENT_RETRY)
				.onErrorResume(error -> {
					if (ExchangeErrors.isUnknownOrder(error)) {
						LOGGER.info("EVENT=CANCEL_ORDER_ALREADY_GONE symbol={} orderId={}", symbol, siblingOrderId);
						return Mono.empty();
					}
					LOGGER.warn("EVENT=SIBLING_CANCEL_FAIL symbol={} orderId={} action=cancel_all_open_orders reason={}",
							symbol, siblingOrderId, ExchangeErrors.describe(error));
					return exchangeGateway.cancelAllOpenOrders(symbol)
							.retryWhen(TRANSIENT_RETRY)
							.onErrorResume(fallbackError -> {
								CriticalAlerts.raise("SIBLING_CANCEL_FAILED", symbol,
										"reduce-only order " + siblingOrderId + " may still be live", fallbackError);
								return Mono.empty();
							});
				});
	}

	// ---- adjustments ----

	public Mono<Void> onAdjustment(Strategy strategy, Position position, AdjustmentCommand command) {
		String symbol = position.symbol();
		if (!pendingSymbols.tryAcquire(symbol)) {
			return Mono.empty();
		}
		return Mono.defer(() -> command.type() == AdjustmentCommand.Type.CLOSE
				? close(position, command)
				: adjust(position, command))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=ADJUSTMENT_FAIL symbol={} strategy={} command={} reason={}", symbol,
							strategy.id(), command.type(), ExchangeErrors.describe(error));
					return Mono.empty();
				})
				.doFinally(signal -> pendingSymbols.release(symbol));
	}

	private Mono<Void> adjust(Position position, AdjustmentCommand command) {
		String symbol = position.symbol();
		return symbolRulesService.resolveRules(symbol)
				.flatMap(rules -> {
					BigDecimal stopLoss = rules.roundPrice(command.stopLoss());
					BigDecimal takeProfit = rules.roundPrice(command.takeProfit());
					if (!isOrdered(position.side(), stopLoss, takeProfit)) {
						LOGGER.warn("EVENT=ADJUST_REJECTED symbol={} reason=invalid_levels sl={} tp={}", symbol,
								stopLoss, takeProfit);
						return Mono.empty();
					}
					if (stopLoss.compareTo(position.stopLoss()) == 0 && takeProfit.compareTo(position.takeProfit()) == 0) {
						return Mono.empty();
					}
					return placeBrackets(symbol, position.side(), position.quantity(),
							new StopLossTakeProfit(stopLoss, takeProfit))
							.flatMap(ids -> cancelIgnoringUnknown(symbol, position.stopLossOrderId())
									.then(cancelIgnoringUnknown(symbol, position.takeProfitOrderId()))
									.then(Mono.defer(() -> commitAdjustment(symbol, stopLoss, takeProfit, ids,
											command.reason()))))
							.onErrorResume(BracketProtectionException.class, error -> {
								LOGGER.warn("EVENT=ADJUST_FAILED symbol={} action=keep_old_brackets reason={}", symbol,
										error.getMessage());
								return Mono.empty();
							})
							.then();
				});
	}

	// A bracket fill handled while the new pair was being placed has already closed the position;
	// the new pair then protects nothing and is cancelled.
	private Mono<Void> commitAdjustment(String symbol, BigDecimal stopLoss, BigDecimal takeProfit,
			BracketOrderIds ids, String reason) {
		if (positionStore.updateBrackets(symbol, stopLoss, takeProfit, ids.stopLossOrderId(),
				ids.takeProfitOrderId()).isPresent()) {
			LOGGER.info("EVENT=BRACKETS_ADJUSTED symbol={} sl={} tp={} slOrderId={} tpOrderId={} reason={}", symbol,
					stopLoss.toPlainString(), takeProfit.toPlainString(), ids.stopLossOrderId(),
					ids.takeProfitOrderId(), reason);
			return Mono.empty();
		}
		LOGGER.warn("EVENT=ADJUST_ABANDONED symbol={} reason=position_closed action=cancel_new_brackets slOrderId={} tpOrderId={}",
				symbol, ids.stopLossOrderId(), ids.takeProfitOrderId());
		return cancelIgnoringUnknown(symbol, ids.stopLossOrderId())
				.then(cancelIgnoringUnknown(symbol, ids.takeProfitOrderId()));
	}

	private Mono<Void> close(Position position, AdjustmentCommand command) {
		String symbol = position.symbol();
		LOGGER.info("EVENT=CLOSE_REQUESTED symbol={} qty={} reason={}", symbol, position.quantity(), command.reason());
		return exchangeGateway.cancelAllOpenOrders(symbol)
				.retryWhen(TRANSIENT_RETRY)
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=CLOSE_CANCEL_OPEN_ORDERS_FAIL symbol={} reason={}", symbol,
							ExchangeErrors.describe(error));
					return Mono.empty();
				})
				.then(exchangeGateway.createOrder(
						OrderRequest.reduceOnlyMarket(symbol, position.side().exitSide(), position.quantity())))
				.doOnNext(response -> LOGGER.info("EVENT=CLOSE_SUBMITTED symbol={} orderId={}", symbol,
						response.orderId()))
				.then(Mono.fromRunnable(() -> positionStore.close(symbol)))
				.onErrorResume(error -> {
					if (ExchangeErrors.isReduceOnlyRejected(error)) {
						LOGGER.info("EVENT=CLOSE_ALREADY_FLAT symbol={}", symbol);
						positionStore.close(symbol);
					} else {
						CriticalAlerts.raise("CLOSE_FAILED", symbol,
								"close order rejected after brackets were cancelled, position kept", error);
					}
					return Mono.empty();
				})
				.then();
	}

	// ---- pending entry expiry ----

	/**
	 * Cancels entry orders older than {@code trading.pending-entry-ttl-ms}. Cleanup follows from
	 * the resulting cancel event; an entry the exchange no longer knows is dropped directly.
	 */
	@Scheduled(fixedDelayString = "${trading.pending-entry-sweep-ms:5000}")
	public void expireStaleEntries() {
		long ttl = tradingProperties.pendingEntryTtlMs();
		if (ttl <= 0) {
			return;
		}
		long cutoff = System.currentTimeMillis() - ttl;
		Flux.fromIterable(pendingEntries.olderThan(cutoff))
				.filter(entry -> entry.orderId() != null)
				.filter(entry -> pendingEntries.markCancelRequested(entry.clientOrderId()))
				.concatMap(this::cancelExpiredEntry)
				.subscribe(null, error -> LOGGER.warn("EVENT=PENDING_SWEEP_FAIL reason={}", error.getMessage()));
	}

	Mono<Void> cancelExpiredEntry(PendingEntry entry) {
		LOGGER.info("EVENT=ENTRY_EXPIRED symbol={} clientOrderId={} orderId={}", entry.symbol(),
				entry.clientOrderId(), entry.orderId());
		return exchangeGateway.cancelOrder(entry.symbol(), entry.orderId())
				.onErrorResume(error -> {
					if (ExchangeErrors.isUnknownOrder(error)) {
						return resolveEntryOffBook(entry);
					}
					pendingEntries.clearCancelRequested(entry.clientOrderId());
					LOGGER.warn("EVENT=ENTRY_CANCEL_FAIL symbol={} action=retry_next_sweep reason={}", entry.symbol(),
							ExchangeErrors.describe(error));
					return Mono.empty();
				});
	}

	/**
	 * The entry order is no longer cancellable. It may have filled while the user-data stream was
	 * down, so its status decides: a fill is protected like any other, otherwise the entry is dropped.
	 */
	private Mono<Void> resolveEntryOffBook(PendingEntry entry) {
		return exchangeGateway.getOrder(entry.symbol(), entry.orderId())
				.onErrorResume(error -> {
					if (ExchangeErrors.isUnknownOrder(error)) {
						dropEntry(entry, "ORDER_NOT_FOUND");
					} else {
						pendingEntries.clearCancelRequested(entry.clientOrderId());
						LOGGER.warn("EVENT=ENTRY_STATUS_FAIL symbol={} action=retry_next_sweep reason={}",
								entry.symbol(), ExchangeErrors.describe(error));
					}
					return Mono.empty();
				})
				.flatMap(order -> {
					if (order.isWorking()) {
						pendingEntries.clearCancelRequested(entry.clientOrderId());
						return Mono.empty();
					}
					if (!order.hasExecutedQuantity()) {
						dropEntry(entry, order.status());
						return Mono.empty();
					}
					return pendingEntries.remove(entry.clientOrderId())
							.map(removed -> {
								LOGGER.warn("EVENT=ENTRY_FILL_RECOVERED symbol={} status={} filledQty={} avgPrice={} clientOrderId={}",
										entry.symbol(), order.status(), order.executedQty().toPlainString(),
										order.avgPrice() == null ? "NA" : order.avgPrice().toPlainString(),
										entry.clientOrderId());
								return protectFill(removed, order.avgPrice(), order.executedQty());
							})
							.orElse(Mono.empty());
				});
	}

	private void dropEntry(PendingEntry entry, String status) {
		pendingEntries.remove(entry.clientOrderId()).ifPresent(removed -> {
			LOGGER.warn("EVENT=ENTRY_DROPPED symbol={} status={} clientOrderId={}", entry.symbol(), status,
					entry.clientOrderId());
			pendingSymbols.release(entry.symbol());
		});
	}

	// ---- helpers ----

	/**
	 * Places both brackets concurrently. On partial failure the order that did get placed is
	 * cancelled and a {@link BracketProtectionException} is signalled.
	 */
	Mono<BracketOrderIds> placeBrackets(String symbol, PositionSide side, BigDecimal quantity,
			StopLossTakeProfit levels) {
		Mono<OrderResponse> stopLoss = exchangeGateway.createOrder(
				OrderRequest.stopMarket(symbol, side.exitSide(), quantity, levels.stopLoss()));
		Mono<OrderResponse> takeProfit = exchangeGateway.createOrder(
				OrderRequest.takeProfitMarket(symbol, side.exitSide(), quantity, levels.takeProfit()));
		return Mono.zip(stopLoss.materialize(), takeProfit.materialize())
				.flatMap(results -> {
					OrderResponse stopLossResponse = results.getT1().get();
					OrderResponse takeProfitResponse = results.getT2().get();
					if (isPlaced(stopLossResponse) && isPlaced(takeProfitResponse)) {
						return Mono.just(new BracketOrderIds(stopLossResponse.orderId(), takeProfitResponse.orderId()));
					}
					Throwable cause = results.getT1().getThrowable() != null ? results.getT1().getThrowable()
							: results.getT2().getThrowable();
					String failed = isPlaced(stopLossResponse) ? "take-profit" : "stop-loss";
					LOGGER.warn("EVENT=BRACKET_PLACEMENT_FAIL symbol={} failed={} sl={} tp={} reason={}", symbol,
							failed, levels.stopLoss(), levels.takeProfit(), ExchangeErrors.describe(cause));
					Mono<Void> cancelSurvivor = Mono.empty();
					if (isPlaced(stopLossResponse)) {
						cancelSurvivor = cancelIgnoringUnknown(symbol, stopLossResponse.orderId());
					} else if (isPlaced(takeProfitResponse)) {
						cancelSurvivor = cancelIgnoringUnknown(symbol, takeProfitResponse.orderId());
					}
					return cancelSurvivor.then(Mono.error(new BracketProtectionException(symbol,
							failed + " order could not be placed", cause)));
				});
	}

	/**
	 * Cancels one order. "Unknown order" means it already filled or was cancelled and counts as
	 * success; other failures are logged and swallowed.
	 */
	Mono<Void> cancelIgnoringUnknown(String symbol, Long orderId) {
		if (orderId == null) {
			return Mono.empty();
		}
		return exchangeGateway.cancelOrder(symbol, orderId)
				.retryWhen(TRANSIENT_RETRY)
				.onErrorResume(error -> {
					if (ExchangeErrors.isUnknownOrder(error)) {
						LOGGER.info("EVENT=CANCEL_ORDER_ALREADY_GONE symbol={} orderId={}", symbol, orderId);
					} else {
						LOGGER.warn("EVENT=CANCEL_ORDER_FAIL symbol={} orderId={} reason={}", symbol, orderId,
								ExchangeErrors.describe(error));
					}
					return Mono.empty();
				});
	}

	private Optional<StopLossTakeProfit> roundedBrackets(Strategy strategy, BigDecimal entryPrice, PositionSide side,
			OrderBookView view, SymbolRules rules) {
		return strategy.calculateStopLossTakeProfit(entryPrice, side, view, rules.priceTick())
				.map(levels -> new StopLossTakeProfit(rules.roundPrice(levels.stopLoss()),
						rules.roundPrice(levels.takeProfit())))
				.filter(levels -> levels.isValidFor(side, entryPrice));
	}

	private OrderBookView currentView(String symbol) {
		if (!orderBookRegistry.isTraded(symbol)) {
			return null;
		}
		return orderBookRegistry.synchronizer(symbol).getDepth(tradingProperties.viewDepth()).orElse(null);
	}

	private static boolean isPlaced(OrderResponse response) {
		return response != null && response.orderId() != null;
	}

	private static boolean isOrdered(PositionSide side, BigDecimal stopLoss, BigDecimal takeProfit) {
		if (stopLoss == null || takeProfit == null) {
			return false;
		}
		return side == PositionSide.LONG ? stopLoss.compareTo(takeProfit) < 0 : stopLoss.compareTo(takeProfit) > 0;
	}

	record BracketOrderIds(long stopLossOrderId, long takeProfitOrderId) {
	}
}
