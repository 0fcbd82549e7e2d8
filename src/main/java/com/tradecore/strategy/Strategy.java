package com.tradecore.strategy;

import java.math.BigDecimal;
import java.util.Optional;

import com.tradecore.exchange.dto.OrderType;
import com.tradecore.market.OrderBookView;
import com.tradecore.position.Position;
import com.tradecore.position.PositionSide;

/**
 * A trading strategy bound to one symbol. Implementations are pure decision logic; they never
 * talk to the exchange.
 */
public interface Strategy {

	String id();

	String symbol();

	/**
	 * {@link OrderType#LIMIT} or {@link OrderType#MARKET}.
	 */
	OrderType entryOrderType();

	/**
	 * Ticks added to (long) or subtracted from (short) the reference price of a limit entry.
	 */
	int entryOffsetTicks();

	Optional<Signal> checkSignal(OrderBookView view);

	/**
	 * Bracket prices for a position entered at {@code entryPrice}. Called again with the actual
	 * fill price once the entry fills.
	 */
	Optional<StopLossTakeProfit> calculateStopLossTakeProfit(BigDecimal entryPrice, PositionSide side,
			OrderBookView view, BigDecimal priceTick);

	default Optional<AdjustmentCommand> analyzeAndAdjust(Position position, OrderBookView view) {
		return Optional.empty();
	}
}
