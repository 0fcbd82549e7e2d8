package com.tradecore.strategy;

import java.math.BigDecimal;

import com.tradecore.position.PositionSide;

public record StopLossTakeProfit(BigDecimal stopLoss, BigDecimal takeProfit) {

	/**
	 * True when the stop is on the losing side of {@code entryPrice} and the target on the
	 * winning side.
	 */
	public boolean isValidFor(PositionSide side, BigDecimal entryPrice) {
		if (stopLoss == null || takeProfit == null || entryPrice == null) {
			return false;
		}
		if (side == PositionSide.LONG) {
			return stopLoss.compareTo(entryPrice) < 0 && takeProfit.compareTo(entryPrice) > 0;
		}
		return stopLoss.compareTo(entryPrice) > 0 && takeProfit.compareTo(entryPrice) < 0;
	}
}
