package com.tradecore.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import com.tradecore.TestFixtures;
import com.tradecore.config.TradingProperties;
import com.tradecore.config.TradingProperties.StrategySlot;
import com.tradecore.exchange.BinanceApiException;
import com.tradecore.exchange.ExchangeGateway;
import com.tradecore.exchange.SymbolRulesService;
import com.tradecore.exchange.dto.OrderRequest;
import com.tradecore.exchange.dto.OrderResponse;
import com.tradecore.exchange.dto.OrderSide;
import com.tradecore.exchange.dto.OrderType;
import com.tradecore.exchange.dto.OrderUpdateEvent;
import com.tradecore.market.OrderBookRegistry;
import com.tradecore.market.OrderBookView;
import com.tradecore.market.PriceLevel;
import com.tradecore.position.Position;
import com.tradecore.position.PositionSide;
import com.tradecore.position.PositionStateFile;
import com.tradecore.position.PositionStore;
import com.tradecore.strategy.AdjustmentCommand;
import com.tradecore.strategy.Signal;
import com.tradecore.strategy.SlotBoundStrategy;
import com.tradecore.strategy.StopLossTakeProfit;
import com.tradecore.strategy.Strategy;
import com.tradecore.strategy.StrategyFactory;
import com.tradecore.strategy.StrategyRegistry;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class OrderLifecycleCoordinatorTest {

	private static final String SYMBOL = "BTCUSDT";

	@TempDir
	Path tempDir;

	private final ExchangeGateway gateway = mock(ExchangeGateway.class);
	private final AtomicLong orderIds = new AtomicLong(100);
	private final List<OrderRequest> submitted = new CopyOnWriteArrayList<>();
	private final Set<OrderType> failingTypes = new CopyOnWriteArraySet<>();
	private final AtomicReference<Runnable> onStopLossSubmitted = new AtomicReference<>();

	private PositionStore store;
	private PendingSymbolTable pendingSymbols;
	private PendingEntryBook pendingEntries;
	private Strategy strategy;
	private Strategy ethStrategy;
	private OrderLifecycleCoordinator coordinator;

	@BeforeEach
	void setUp() {
		TradingProperties tradingProperties = TestFixtures.tradingProperties(
				List.of(new StrategySlot("s1", "offset", SYMBOL, OrderType.LIMIT, 0, Map.of()),
						new StrategySlot("s2", "offset", "ETHUSDT", OrderType.LIMIT, 0, Map.of())));
		store = new PositionStore(new PositionStateFile(tempDir.resolve("positions.json"), TestFixtures.objectMapper()));
		pendingSymbols = new PendingSymbolTable();
		pendingEntries = new PendingEntryBook();
		StrategyRegistry registry = new StrategyRegistry(List.of(new OffsetStrategyFactory()), tradingProperties);
		strategy = registry.find("s1").orElseThrow();
		ethStrategy = registry.find("s2").orElseThrow();
		coordinator = new OrderLifecycleCoordinator(gateway, store, pendingSymbols, pendingEntries,
				new SymbolRulesService(gateway), registry, new OrderBookRegistry(tradingProperties), tradingProperties);

		when(gateway.getSymbolRules(SYMBOL)).thenReturn(Mono.just(TestFixtures.btcRules()));
		when(gateway.getAccountBalance("USDT")).thenReturn(Mono.just(new BigDecimal("1000")));
		when(gateway.cancelOrder(anyString(), anyLong())).thenReturn(Mono.empty());
		when(gateway.cancelAllOpenOrders(anyString())).thenReturn(Mono.empty());
		when(gateway.createOrder(any())).thenAnswer(invocation -> {
			OrderRequest request = invocation.getArgument(0);
			submitted.add(request);
			Runnable hook = request.type() == OrderType.STOP_MARKET ? onStopLossSubmitted.getAndSet(null) : null;
			if (hook != null) {
				hook.run();
			}
			if (failingTypes.contains(request.type())) {
				return Mono.error(new BinanceApiException(-2021, 400, "Order would immediately trigger."));
			}
			return Mono.just(new OrderResponse(orderIds.incrementAndGet(), request.clientOrderId(), request.symbol(),
					"NEW", request.side().name(), request.type().name(), request.quantity(), BigDecimal.ZERO,
					BigDecimal.ZERO));
		});
	}

	@Test
	void signalSubmitsSizedLimitEntryAndMarksSymbolPending() {
		StepVerifier.create(coordinator.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view()))
				.verifyComplete();

		assertThat(submitted).hasSize(1);
		OrderRequest entry = submitted.get(0);
		assertThat(entry.type()).isEqualTo(OrderType.LIMIT);
		assertThat(entry.side()).isEqualTo(OrderSide.BUY);
		// 1000 * 0.1 * 10 / 100
		assertThat(entry.quantity()).isEqualByComparingTo("10");
		assertThat(entry.price()).isEqualByComparingTo("100");
		assertThat(entry.clientOrderId()).startsWith(ClientOrderIds.PREFIX);
		assertTrue(pendingSymbols.isPending(SYMBOL));
		PendingEntry pending = pendingEntries.findBySymbol(SYMBOL).orElseThrow();
		assertThat(pending.orderId()).isEqualTo(101L);
		assertThat(pending.estimatedBrackets().stopLoss()).isEqualByComparingTo("99");
	}

	@Test
	void secondSignalWhilePendingIsIgnored() {
		coordinator.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view()).block();
		coordinator.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view()).block();

		assertThat(submitted).hasSize(1);
		assertEquals(1, pendingEntries.size());
	}

	@Test
	void bracketsUseActualFillPrice() {
		String clientOrderId = enterLong();

		StepVerifier.create(coordinator.onOrderUpdate(fill(101L, clientOrderId, "100.2", "10"))).verifyComplete();

		OrderRequest stopLoss = submittedOfType(OrderType.STOP_MARKET);
		OrderRequest takeProfit = submittedOfType(OrderType.TAKE_PROFIT_MARKET);
		assertThat(stopLoss.stopPrice()).isEqualByComparingTo("99.2");
		assertThat(takeProfit.stopPrice()).isEqualByComparingTo("102.2");
		assertThat(stopLoss.side()).isEqualTo(OrderSide.SELL);
		assertTrue(stopLoss.reduceOnly());
		assertThat(stopLoss.quantity()).isEqualByComparingTo("10");

		Position position = store.get(SYMBOL).orElseThrow();
		assertThat(position.entryPrice()).isEqualByComparingTo("100.2");
		assertThat(position.stopLossOrderId()).isEqualTo(102L);
		assertThat(position.takeProfitOrderId()).isEqualTo(103L);
		assertThat(position.initialStopLoss()).isEqualByComparingTo("99.2");
		assertThat(position.strategyId()).isEqualTo("s1");
		assertFalse(pendingSymbols.isPending(SYMBOL));
		assertEquals(0, pendingEntries.size());
	}

	@Test
	void takeProfitFailureCancelsStopLossAndFlattens() {
		String clientOrderId = enterLong();
		failingTypes.add(OrderType.TAKE_PROFIT_MARKET);

		StepVerifier.create(coordinator.onOrderUpdate(fill(101L, clientOrderId, "100", "10"))).verifyComplete();

		verify(gateway).cancelOrder(SYMBOL, 102L);
		OrderRequest flatten = submitted.get(submitted.size() - 1);
		assertThat(flatten.type()).isEqualTo(OrderType.MARKET);
		assertThat(flatten.side()).isEqualTo(OrderSide.SELL);
		assertTrue(flatten.reduceOnly());
		assertThat(flatten.quantity()).isEqualByComparingTo("10");
		assertThat(store.get(SYMBOL)).isEmpty();
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void failedFlattenStillReleasesPendingMarker() {
		String clientOrderId = enterLong();
		failingTypes.add(OrderType.STOP_MARKET);
		failingTypes.add(OrderType.MARKET);

		StepVerifier.create(coordinator.onOrderUpdate(fill(101L, clientOrderId, "100", "10"))).verifyComplete();

		verify(gateway).cancelOrder(SYMBOL, 102L);
		assertThat(store.get(SYMBOL)).isEmpty();
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void canceledEntryReleasesSymbolWithoutPosition() {
		String clientOrderId = enterLong();

		coordinator.onOrderUpdate(update(101L, clientOrderId, "CANCELED", "LIMIT", "0", "0")).block();

		assertFalse(pendingSymbols.isPending(SYMBOL));
		assertEquals(0, pendingEntries.size());
		assertThat(store.get(SYMBOL)).isEmpty();
		assertThat(submitted).hasSize(1);
	}

	@Test
	void expiredEntryWithPartialFillIsProtectedForFilledQuantity() {
		String clientOrderId = enterLong();

		coordinator.onOrderUpdate(update(101L, clientOrderId, "EXPIRED", "LIMIT", "100", "4")).block();

		Position position = store.get(SYMBOL).orElseThrow();
		assertThat(position.quantity()).isEqualByComparingTo("4");
		assertThat(submittedOfType(OrderType.STOP_MARKET).quantity()).isEqualByComparingTo("4");
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void rejectedEntryReleasesSymbol() {
		failingTypes.add(OrderType.LIMIT);

		coordinator.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view()).block();

		assertFalse(pendingSymbols.isPending(SYMBOL));
		assertEquals(0, pendingEntries.size());
	}

	@Test
	void zeroQuantityAbortsWithoutOrder() {
		when(gateway.getAccountBalance("USDT")).thenReturn(Mono.just(new BigDecimal("0.001")));

		coordinator.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view()).block();

		assertThat(submitted).isEmpty();
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void maxActiveTradesBlocksNewEntries() {
		store.set(openLong("ETHUSDT"));
		store.set(openLong("SOLUSDT"));
		store.set(openLong("XRPUSDT"));

		coordinator.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view()).block();

		assertThat(submitted).isEmpty();
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void bracketFillCancelsSiblingAndClosesOnce() {
		store.set(openLong(SYMBOL));
		when(gateway.cancelOrder(SYMBOL, 12L))
				.thenReturn(Mono.error(new BinanceApiException(-2011, 400, "Unknown order sent.")));

		coordinator.onOrderUpdate(update(11L, "sl", "FILLED", "STOP_MARKET", "95", "1")).block();
		coordinator.onOrderUpdate(update(11L, "sl", "FILLED", "STOP_MARKET", "95", "1")).block();

		verify(gateway, times(1)).cancelOrder(SYMBOL, 12L);
		verify(gateway, never()).cancelAllOpenOrders(SYMBOL);
		assertThat(store.get(SYMBOL)).isEmpty();
	}

	@Test
	void failedSiblingCancelFallsBackToCancellingAllOrders() {
		store.set(openLong(SYMBOL));
		when(gateway.cancelOrder(SYMBOL, 11L))
				.thenReturn(Mono.error(new BinanceApiException(-1021, 400, "Timestamp outside recvWindow.")));

		coordinator.onOrderUpdate(update(12L, "tp", "FILLED", "TAKE_PROFIT_MARKET", "110", "1")).block();

		verify(gateway).cancelAllOpenOrders(SYMBOL);
		assertThat(store.get(SYMBOL)).isEmpty();
	}

	@Test
	void adjustPlacesNewBracketsBeforeCancellingOldOnes() {
		store.set(openLong(SYMBOL));

		coordinator.onAdjustment(strategy, store.get(SYMBOL).orElseThrow(),
				AdjustmentCommand.adjust(new BigDecimal("100"), new BigDecimal("120"), "break-even")).block();

		InOrder order = inOrder(gateway);
		order.verify(gateway, times(2)).createOrder(any());
		order.verify(gateway).cancelOrder(SYMBOL, 11L);
		order.verify(gateway).cancelOrder(SYMBOL, 12L);
		Position updated = store.get(SYMBOL).orElseThrow();
		assertThat(updated.stopLoss()).isEqualByComparingTo("100");
		assertThat(updated.takeProfit()).isEqualByComparingTo("120");
		assertThat(updated.stopLossOrderId()).isEqualTo(101L);
		assertThat(updated.takeProfitOrderId()).isEqualTo(102L);
		assertThat(updated.initialStopLoss()).isEqualByComparingTo("95");
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void bracketFillDuringAdjustmentCancelsTheNewPair() {
		store.set(openLong(SYMBOL));
		onStopLossSubmitted.set(() -> coordinator
				.onOrderUpdate(update(11L, "sl", "FILLED", "STOP_MARKET", "95", "1")).block());

		coordinator.onAdjustment(strategy, store.get(SYMBOL).orElseThrow(),
				AdjustmentCommand.adjust(new BigDecimal("100"), new BigDecimal("120"), "trail")).block();

		verify(gateway).cancelOrder(SYMBOL, 101L);
		verify(gateway).cancelOrder(SYMBOL, 102L);
		assertThat(store.get(SYMBOL)).isEmpty();
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void failedAdjustKeepsOldBracketsAndRemovesOrphan() {
		store.set(openLong(SYMBOL));
		failingTypes.add(OrderType.TAKE_PROFIT_MARKET);

		coordinator.onAdjustment(strategy, store.get(SYMBOL).orElseThrow(),
				AdjustmentCommand.adjust(new BigDecimal("100"), new BigDecimal("120"), "trail")).block();

		verify(gateway).cancelOrder(SYMBOL, 101L);
		verify(gateway, never()).cancelOrder(SYMBOL, 11L);
		verify(gateway, never()).cancelOrder(SYMBOL, 12L);
		Position unchanged = store.get(SYMBOL).orElseThrow();
		assertThat(unchanged.stopLossOrderId()).isEqualTo(11L);
		assertThat(unchanged.takeProfitOrderId()).isEqualTo(12L);
	}

	@Test
	void adjustWithInvertedLevelsIsRejected() {
		store.set(openLong(SYMBOL));

		coordinator.onAdjustment(strategy, store.get(SYMBOL).orElseThrow(),
				AdjustmentCommand.adjust(new BigDecimal("120"), new BigDecimal("100"), "bad")).block();

		assertThat(submitted).isEmpty();
		assertThat(store.get(SYMBOL).orElseThrow().stopLossOrderId()).isEqualTo(11L);
	}

	@Test
	void closeCancelsOrdersThenFlattensAndRemovesPosition() {
		store.set(openLong(SYMBOL));

		coordinator.onAdjustment(strategy, store.get(SYMBOL).orElseThrow(), AdjustmentCommand.close("exit")).block();

		InOrder order = inOrder(gateway);
		order.verify(gateway).cancelAllOpenOrders(SYMBOL);
		order.verify(gateway).createOrder(any());
		OrderRequest close = submitted.get(0);
		assertTrue(close.reduceOnly());
		assertThat(close.side()).isEqualTo(OrderSide.SELL);
		assertThat(close.quantity()).isEqualByComparingTo("1");
		assertThat(store.get(SYMBOL)).isEmpty();
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void closeRejectedAsReduceOnlyStillRemovesPosition() {
		store.set(openLong(SYMBOL));
		when(gateway.createOrder(any()))
				.thenReturn(Mono.error(new BinanceApiException(-2022, 400, "ReduceOnly Order is rejected.")));

		coordinator.onAdjustment(strategy, store.get(SYMBOL).orElseThrow(), AdjustmentCommand.close("exit")).block();

		assertThat(store.get(SYMBOL)).isEmpty();
	}

	@Test
	void closeFailingForOtherReasonKeepsPosition() {
		store.set(openLong(SYMBOL));
		when(gateway.createOrder(any()))
				.thenReturn(Mono.error(new BinanceApiException(-2019, 400, "Margin is insufficient.")));

		coordinator.onAdjustment(strategy, store.get(SYMBOL).orElseThrow(), AdjustmentCommand.close("exit")).block();

		assertThat(store.get(SYMBOL)).isPresent();
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void expiredPendingEntryIsCancelledOnce() {
		String clientOrderId = enterLong();
		PendingEntry pending = pendingEntries.findByClientOrderId(clientOrderId).orElseThrow();

		assertTrue(pendingEntries.markCancelRequested(clientOrderId));
		coordinator.cancelExpiredEntry(pending).block();

		verify(gateway).cancelOrder(SYMBOL, 101L);
		assertFalse(pendingEntries.markCancelRequested(clientOrderId));
		assertTrue(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void expiredEntryCancelledElsewhereIsDropped() {
		String clientOrderId = enterLong();
		when(gateway.cancelOrder(SYMBOL, 101L))
				.thenReturn(Mono.error(new BinanceApiException(-2011, 400, "Unknown order sent.")));
		when(gateway.getOrder(SYMBOL, 101L)).thenReturn(Mono.just(orderStatus("CANCELED", "0", "0")));

		coordinator.cancelExpiredEntry(pendingEntries.findByClientOrderId(clientOrderId).orElseThrow()).block();

		assertEquals(0, pendingEntries.size());
		assertFalse(pendingSymbols.isPending(SYMBOL));
		assertThat(submitted).isEmpty();
	}

	@Test
	void expiredEntryThatFilledUnnoticedIsProtected() {
		String clientOrderId = enterLong();
		when(gateway.cancelOrder(SYMBOL, 101L))
				.thenReturn(Mono.error(new BinanceApiException(-2011, 400, "Unknown order sent.")));
		when(gateway.getOrder(SYMBOL, 101L)).thenReturn(Mono.just(orderStatus("FILLED", "10", "100.3")));

		coordinator.cancelExpiredEntry(pendingEntries.findByClientOrderId(clientOrderId).orElseThrow()).block();

		Position position = store.get(SYMBOL).orElseThrow();
		assertThat(position.entryPrice()).isEqualByComparingTo("100.3");
		assertThat(position.quantity()).isEqualByComparingTo("10");
		assertThat(submittedOfType(OrderType.STOP_MARKET).stopPrice()).isEqualByComparingTo("99.3");
		assertEquals(0, pendingEntries.size());
		assertFalse(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void failedExpiryCancelIsRetriedOnNextSweep() {
		String clientOrderId = enterLong();
		when(gateway.cancelOrder(SYMBOL, 101L))
				.thenReturn(Mono.error(new BinanceApiException(-1001, 400, "Internal error; unable to process.")));
		assertTrue(pendingEntries.markCancelRequested(clientOrderId));

		coordinator.cancelExpiredEntry(pendingEntries.findByClientOrderId(clientOrderId).orElseThrow()).block();

		assertTrue(pendingEntries.markCancelRequested(clientOrderId));
		assertTrue(pendingSymbols.isPending(SYMBOL));
	}

	@Test
	void entryCapCountsSymbolsStillBeingSized() {
		store.set(openLong("SOLUSDT"));
		store.set(openLong("XRPUSDT"));
		when(gateway.getAccountBalance("USDT")).thenReturn(Mono.never());

		Disposable btcEntry = coordinator
				.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view())
				.subscribe();
		try {
			StepVerifier.create(coordinator.onSignal(ethStrategy, new Signal(OrderSide.BUY, new BigDecimal("100")),
					view()))
					.expectComplete()
					.verify(Duration.ofSeconds(5));
		} finally {
			btcEntry.dispose();
		}

		verify(gateway, times(1)).getAccountBalance("USDT");
		assertFalse(pendingSymbols.isPending("ETHUSDT"));
		assertTrue(pendingSymbols.isPending(SYMBOL));
	}

	private String enterLong() {
		coordinator.onSignal(strategy, new Signal(OrderSide.BUY, new BigDecimal("100")), view()).block();
		submitted.clear();
		return pendingEntries.findBySymbol(SYMBOL).orElseThrow().clientOrderId();
	}

	private OrderRequest submittedOfType(OrderType type) {
		return submitted.stream().filter(request -> request.type() == type).findFirst().orElseThrow();
	}

	private static OrderResponse orderStatus(String status, String executedQty, String avgPrice) {
		return new OrderResponse(101L, null, SYMBOL, status, "BUY", "LIMIT", new BigDecimal("10"),
				new BigDecimal(executedQty), new BigDecimal(avgPrice));
	}

	private static Position openLong(String symbol) {
		return new Position(symbol, PositionSide.LONG, new BigDecimal("1"), new BigDecimal("100"),
				new BigDecimal("95"), new BigDecimal("110"), new BigDecimal("95"), 11L, 12L, "s1", 1L);
	}

	private static OrderBookView view() {
		return new OrderBookView(SYMBOL, new BigDecimal("99.9"), new BigDecimal("100.1"),
				List.of(new PriceLevel(new BigDecimal("99.9"), BigDecimal.ONE)),
				List.of(new PriceLevel(new BigDecimal("100.1"), BigDecimal.ONE)), 1L);
	}

	private static OrderUpdateEvent fill(long orderId, String clientOrderId, String price, String qty) {
		return update(orderId, clientOrderId, "FILLED", "LIMIT", price, qty);
	}

	private static OrderUpdateEvent update(long orderId, String clientOrderId, String status, String type,
			String price, String qty) {
		return new OrderUpdateEvent(SYMBOL, orderId, clientOrderId, status, type, new BigDecimal(price),
				new BigDecimal(qty), false, System.currentTimeMillis());
	}

	/**
	 * Stop one unit below / target two units above the entry for longs, mirrored for shorts.
	 */
	private static final class OffsetStrategyFactory implements StrategyFactory {

		@Override
		public String type() {
			return "offset";
		}

		@Override
		public Strategy create(StrategySlot slot) {
			return new SlotBoundStrategy(slot) {

				@Override
				public Optional<Signal> checkSignal(OrderBookView view) {
					return Optional.empty();
				}

				@Override
				public Optional<StopLossTakeProfit> calculateStopLossTakeProfit(BigDecimal entryPrice,
						PositionSide side, OrderBookView view, BigDecimal priceTick) {
					BigDecimal direction = side == PositionSide.LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
					return Optional.of(new StopLossTakeProfit(entryPrice.subtract(direction),
							entryPrice.add(direction.multiply(BigDecimal.valueOf(2)))));
				}
			};
		}
	}
}
