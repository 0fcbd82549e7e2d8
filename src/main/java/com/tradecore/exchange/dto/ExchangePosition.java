package com.tradecore.exchange.dto;

import java.math.BigDecimal;

/**
 * A non-zero futures position as reported by the exchange. {@code positionAmt} is signed:
 * positive for long, negative for short.
 */
public record ExchangePosition(
		String symbol,
		BigDecimal positionAmt,
		BigDecimal entryPrice,
		int leverage) {

	public boolean isLong() {
		return positionAmt.signum() > 0;
	}

	public BigDecimal absoluteQuantity() {
		return positionAmt.abs();
	}
}
