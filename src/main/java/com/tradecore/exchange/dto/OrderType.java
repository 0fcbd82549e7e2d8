package com.tradecore.exchange.dto;

public enum OrderType {
	MARKET,
	LIMIT,
	STOP_MARKET,
	TAKE_PROFIT_MARKET
}
