package com.tradecore.execution;

import java.math.BigDecimal;
import java.math.MathContext;

import com.tradecore.exchange.dto.OrderSide;
import com.tradecore.exchange.dto.SymbolRules;

public final class PositionSizer {

	private PositionSizer() {
	}

	/**
	 * {@code balance * marginFraction * leverage / price}, floored to the quantity step. Returns
	 * zero when the result is below the step or the symbol's minimum quantity.
	 */
	public static BigDecimal quantity(BigDecimal balance, BigDecimal marginFraction, int leverage,
			BigDecimal price, SymbolRules rules) {
		if (balance == null || price == null || balance.signum() <= 0 || price.signum() <= 0) {
			return BigDecimal.ZERO;
		}
		BigDecimal notional = balance.multiply(marginFraction).multiply(BigDecimal.valueOf(leverage));
		BigDecimal raw = notional.divide(price, MathContext.DECIMAL64);
		BigDecimal floored = rules.floorQuantity(raw);
		if (floored == null || floored.signum() <= 0) {
			return BigDecimal.ZERO;
		}
		if (rules.minQuantity() != null && floored.compareTo(rules.minQuantity()) < 0) {
			return BigDecimal.ZERO;
		}
		return floored;
	}

	/**
	 * Limit price for an entry: the reference moved {@code offsetTicks} ticks in the direction
	 * of the trade (up for buys, down for sells), rounded to the tick.
	 */
	public static BigDecimal limitEntryPrice(BigDecimal referencePrice, OrderSide side, int offsetTicks,
			SymbolRules rules) {
		BigDecimal tick = rules.priceTick() == null ? BigDecimal.ZERO : rules.priceTick();
		BigDecimal offset = tick.multiply(BigDecimal.valueOf(offsetTicks));
		BigDecimal price = side == OrderSide.BUY ? referencePrice.add(offset) : referencePrice.subtract(offset);
		return rules.roundPrice(price);
	}
}
