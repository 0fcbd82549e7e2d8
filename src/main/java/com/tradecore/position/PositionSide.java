package com.tradecore.position;

import com.tradecore.exchange.dto.OrderSide;

public enum PositionSide {
	LONG,
	SHORT;

	public static PositionSide fromEntrySide(OrderSide side) {
		return side == OrderSide.BUY ? LONG : SHORT;
	}

	public OrderSide entrySide() {
		return this == LONG ? OrderSide.BUY : OrderSide.SELL;
	}

	/**
	 * Side of every order that reduces the position: brackets, rollbacks and closes.
	 */
	public OrderSide exitSide() {
		return entrySide().opposite();
	}
}
