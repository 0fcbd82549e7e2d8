package com.tradecore.exchange.dto;

import java.math.BigDecimal;

public record OrderResponse(
		Long orderId,
		String clientOrderId,
		String symbol,
		String status,
		String side,
		String type,
		BigDecimal origQty,
		BigDecimal executedQty,
		BigDecimal avgPrice) {

	public boolean hasExecutedQuantity() {
		return executedQty != null && executedQty.signum() > 0;
	}

	/**
	 * Still on the book: {@code NEW} or {@code PARTIALLY_FILLED}.
	 */
	public boolean isWorking() {
		return "NEW".equals(status) || "PARTIALLY_FILLED".equals(status);
	}
}
