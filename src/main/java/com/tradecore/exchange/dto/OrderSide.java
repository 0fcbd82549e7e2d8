package com.tradecore.exchange.dto;

public enum OrderSide {
	BUY,
	SELL;

	public OrderSide opposite() {
		return this == BUY ? SELL : BUY;
	}
}
