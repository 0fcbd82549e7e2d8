package com.tradecore.strategy;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A strategy's request to change an open position: move its brackets or close it.
 */
public record AdjustmentCommand(Type type, BigDecimal stopLoss, BigDecimal takeProfit, String reason) {

	public enum Type {
		ADJUST,
		CLOSE
	}

	public AdjustmentCommand {
		Objects.requireNonNull(type, "type");
		if (type == Type.ADJUST && (stopLoss == null || takeProfit == null)) {
			throw new IllegalArgumentException("ADJUST requires both stopLoss and takeProfit");
		}
	}

	public static AdjustmentCommand adjust(BigDecimal stopLoss, BigDecimal takeProfit, String reason) {
		return new AdjustmentCommand(Type.ADJUST, stopLoss, takeProfit, reason);
	}

	public static AdjustmentCommand close(String reason) {
		return new AdjustmentCommand(Type.CLOSE, null, null, reason);
	}
}
