package com.tradecore.execution;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tradecore.TestFixtures;
import com.tradecore.exchange.dto.OrderSide;
import com.tradecore.market.BookUpdateSignal;
import com.tradecore.market.OrderBookSynchronizer;
import com.tradecore.market.dto.OrderBookDepthResponse;
import com.tradecore.position.Position;
import com.tradecore.position.PositionSide;
import com.tradecore.position.PositionStateFile;
import com.tradecore.position.PositionStore;
import com.tradecore.strategy.AdjustmentCommand;
import com.tradecore.strategy.Signal;
import com.tradecore.strategy.Strategy;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class SymbolMonitorTest {

	private static final String SYMBOL = "BTCUSDT";

	@TempDir
	Path tempDir;

	private final Strategy strategy = mock(Strategy.class);
	private final OrderLifecycleCoordinator coordinator = mock(OrderLifecycleCoordinator.class);
	private final PendingSymbolTable pendingSymbols = new PendingSymbolTable();
	private final OrderBookSynchronizer synchronizer = new OrderBookSynchronizer(SYMBOL, 10, true);
	private PositionStore store;
	private SymbolMonitor monitor;

	@BeforeEach
	void setUp() {
		store = new PositionStore(new PositionStateFile(tempDir.resolve("positions.json"), TestFixtures.objectMapper()));
		monitor = new SymbolMonitor(strategy, synchronizer, new BookUpdateSignal(), store, pendingSymbols,
				coordinator, 5);
		when(strategy.id()).thenReturn("s1");
		when(strategy.symbol()).thenReturn(SYMBOL);
		when(coordinator.onSignal(any(), any(), any())).thenReturn(Mono.empty());
		when(coordinator.onAdjustment(any(), any(), any())).thenReturn(Mono.empty());
	}

	@Test
	void unsyncedBookSkipsStrategy() {
		StepVerifier.create(monitor.tick()).verifyComplete();

		verifyNoInteractions(coordinator);
		verify(strategy, never()).checkSignal(any());
	}

	@Test
	void flatSymbolForwardsSignal() {
		syncBook();
		Signal signal = new Signal(OrderSide.BUY, new BigDecimal("100"));
		when(strategy.checkSignal(any())).thenReturn(Optional.of(signal));

		monitor.tick().block();

		verify(coordinator).onSignal(any(), any(), any());
	}

	@Test
	void pendingSymbolSkipsSignal() {
		syncBook();
		pendingSymbols.tryAcquire(SYMBOL);

		monitor.tick().block();

		verify(strategy, never()).checkSignal(any());
	}

	@Test
	void openPositionIsHandedToAdjustment() {
		syncBook();
		store.set(position("s1"));
		when(strategy.analyzeAndAdjust(any(), any())).thenReturn(Optional.of(AdjustmentCommand.close("exit")));

		monitor.tick().block();

		verify(coordinator).onAdjustment(any(), any(), any());
		verify(strategy, never()).checkSignal(any());
	}

	@Test
	void positionOfAnotherStrategyIsLeftAlone() {
		syncBook();
		store.set(position("other"));

		monitor.tick().block();

		verify(strategy, never()).analyzeAndAdjust(any(), any());
		verifyNoInteractions(coordinator);
	}

	@Test
	void failingStrategyDoesNotFailTick() {
		syncBook();
		when(strategy.checkSignal(any())).thenThrow(new IllegalStateException("boom"));

		StepVerifier.create(monitor.tick()).verifyComplete();
	}

	private void syncBook() {
		synchronizer.applySnapshot(new OrderBookDepthResponse(10, List.of(List.of("99.9", "1")),
				List.of(List.of("100.1", "1"))));
	}

	private static Position position(String strategyId) {
		return new Position(SYMBOL, PositionSide.LONG, BigDecimal.ONE, new BigDecimal("100"), new BigDecimal("95"),
				new BigDecimal("110"), new BigDecimal("95"), 11L, 12L, strategyId, 1L);
	}
}
