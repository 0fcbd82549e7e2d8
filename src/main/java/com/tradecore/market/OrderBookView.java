package com.tradecore.market;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Immutable copy of the top of a local order book. Bids are ordered best (highest) first,
 * asks best (lowest) first.
 */
public record OrderBookView(
		String symbol,
		BigDecimal bestBid,
		BigDecimal bestAsk,
		List<PriceLevel> bids,
		List<PriceLevel> asks,
		long lastUpdateId) {

	private static final BigDecimal TWO = BigDecimal.valueOf(2);

	public boolean hasBothSides() {
		return bestBid != null && bestAsk != null;
	}

	public BigDecimal mid() {
		if (!hasBothSides()) {
			return null;
		}
		return bestBid.add(bestAsk).divide(TWO, MathContext.DECIMAL64);
	}
}
