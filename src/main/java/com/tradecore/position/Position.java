package com.tradecore.position;

import java.math.BigDecimal;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An open, bracket-protected position. {@code initialStopLoss} is the stop placed at entry
 * and never changes, so strategies can tell whether the stop was already moved.
 */
public record Position(
		String symbol,
		PositionSide side,
		BigDecimal quantity,
		BigDecimal entryPrice,
		BigDecimal stopLoss,
		BigDecimal takeProfit,
		BigDecimal initialStopLoss,
		Long stopLossOrderId,
		Long takeProfitOrderId,
		String strategyId,
		long openedAt) {

	public Position {
		Objects.requireNonNull(symbol, "symbol");
		Objects.requireNonNull(side, "side");
		Objects.requireNonNull(quantity, "quantity");
	}

	@JsonIgnore
	public boolean isProtected() {
		return stopLossOrderId != null && takeProfitOrderId != null;
	}

	public boolean isBracketOrder(long orderId) {
		return (stopLossOrderId != null && stopLossOrderId == orderId)
				|| (takeProfitOrderId != null && takeProfitOrderId == orderId);
	}

	/**
	 * The other order of the bracket pair, or {@code null} when {@code orderId} is not part of it.
	 */
	public Long siblingOf(long orderId) {
		if (stopLossOrderId != null && stopLossOrderId == orderId) {
			return takeProfitOrderId;
		}
		if (takeProfitOrderId != null && takeProfitOrderId == orderId) {
			return stopLossOrderId;
		}
		return null;
	}

	public Position withQuantity(BigDecimal newQuantity) {
		return new Position(symbol, side, newQuantity, entryPrice, stopLoss, takeProfit, initialStopLoss,
				stopLossOrderId, takeProfitOrderId, strategyId, openedAt);
	}

	public Position withBracketOrders(Long newStopLossOrderId, Long newTakeProfitOrderId) {
		return new Position(symbol, side, quantity, entryPrice, stopLoss, takeProfit, initialStopLoss,
				newStopLossOrderId, newTakeProfitOrderId, strategyId, openedAt);
	}

	public Position withBrackets(BigDecimal newStopLoss, BigDecimal newTakeProfit,
			Long newStopLossOrderId, Long newTakeProfitOrderId) {
		return new Position(symbol, side, quantity, entryPrice, newStopLoss, newTakeProfit, initialStopLoss,
				newStopLossOrderId, newTakeProfitOrderId, strategyId, openedAt);
	}
}
