package com.tradecore.execution;

import java.math.BigDecimal;

import com.tradecore.exchange.dto.OrderSide;
import com.tradecore.exchange.dto.OrderType;
import com.tradecore.strategy.StopLossTakeProfit;

/**
 * An entry order that was submitted but has not filled yet. {@code estimatedBrackets} are the
 * brackets for the intended price; the real ones are recomputed from the fill price.
 */
public record PendingEntry(
		String clientOrderId,
		String symbol,
		String strategyId,
		OrderSide side,
		OrderType orderType,
		BigDecimal quantity,
		BigDecimal intendedPrice,
		StopLossTakeProfit estimatedBrackets,
		long createdAt,
		Long orderId,
		boolean cancelRequested) {

	public PendingEntry withOrderId(Long newOrderId) {
		return new PendingEntry(clientOrderId, symbol, strategyId, side, orderType, quantity, intendedPrice,
				estimatedBrackets, createdAt, newOrderId, cancelRequested);
	}

	public PendingEntry withCancelRequested(boolean requested) {
		return new PendingEntry(clientOrderId, symbol, strategyId, side, orderType, quantity, intendedPrice,
				estimatedBrackets, createdAt, orderId, requested);
	}
}
