package com.tradecore.exchange.dto;

import java.math.BigDecimal;
import java.util.Set;

/**
 * An {@code ORDER_TRADE_UPDATE} from the user-data stream, reduced to the fields the
 * position lifecycle needs.
 */
public record OrderUpdateEvent(
		String symbol,
		long orderId,
		String clientOrderId,
		String status,
		String orderType,
		BigDecimal avgFillPrice,
		BigDecimal filledQuantity,
		boolean reduceOnly,
		long eventTime) {

	private static final Set<String> NO_FILL_TERMINAL = Set.of("CANCELED", "EXPIRED", "REJECTED");

	public boolean isFilled() {
		return "FILLED".equals(status);
	}

	public boolean isCanceledOrExpired() {
		return NO_FILL_TERMINAL.contains(status);
	}

	public boolean hasFilledQuantity() {
		return filledQuantity != null && filledQuantity.signum() > 0;
	}
}
