package com.tradecore.strategy;

import java.math.BigDecimal;
import java.util.Objects;

import com.tradecore.exchange.dto.OrderSide;

/**
 * Entry signal: the side to enter and the price the strategy based it on.
 */
public record Signal(OrderSide side, BigDecimal referencePrice) {

	public Signal {
		Objects.requireNonNull(side, "side");
		Objects.requireNonNull(referencePrice, "referencePrice");
	}
}
