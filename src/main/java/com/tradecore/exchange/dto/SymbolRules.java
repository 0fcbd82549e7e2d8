package com.tradecore.exchange.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Trading filters of one symbol. Rounded values carry the scale of the tick or step, so they
 * print in plain notation ({@code 100.0}, never {@code 1E+2}).
 */
public record SymbolRules(
		String symbol,
		BigDecimal priceTick,
		BigDecimal quantityStep,
		int pricePrecision,
		int quantityPrecision,
		BigDecimal minQuantity) {

	public BigDecimal roundPrice(BigDecimal price) {
		if (price == null || priceTick == null || priceTick.signum() <= 0) {
			return price;
		}
		BigDecimal ticks = price.divide(priceTick, 0, RoundingMode.HALF_UP);
		return toIncrementScale(ticks.multiply(priceTick), priceTick);
	}

	public BigDecimal floorQuantity(BigDecimal quantity) {
		if (quantity == null || quantityStep == null || quantityStep.signum() <= 0) {
			return quantity;
		}
		BigDecimal steps = quantity.divide(quantityStep, 0, RoundingMode.DOWN);
		return toIncrementScale(steps.multiply(quantityStep), quantityStep);
	}

	// exchange filters arrive as "0.10000000"; the value is an exact multiple, so no rounding happens
	private static BigDecimal toIncrementScale(BigDecimal value, BigDecimal increment) {
		return value.setScale(Math.max(increment.stripTrailingZeros().scale(), 0), RoundingMode.UNNECESSARY);
	}
}
