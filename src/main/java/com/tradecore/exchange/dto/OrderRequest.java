package com.tradecore.exchange.dto;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A futures order as submitted to the exchange. {@code price} is only set for limit orders,
 * {@code stopPrice} only for triggered (stop / take-profit) orders.
 */
public record OrderRequest(
		String symbol,
		OrderSide side,
		OrderType type,
		BigDecimal quantity,
		BigDecimal price,
		BigDecimal stopPrice,
		boolean reduceOnly,
		String clientOrderId) {

	public OrderRequest {
		Objects.requireNonNull(symbol, "symbol");
		Objects.requireNonNull(side, "side");
		Objects.requireNonNull(type, "type");
		Objects.requireNonNull(quantity, "quantity");
		if (type == OrderType.LIMIT && price == null) {
			throw new IllegalArgumentException("LIMIT order requires a price");
		}
		if ((type == OrderType.STOP_MARKET || type == OrderType.TAKE_PROFIT_MARKET) && stopPrice == null) {
			throw new IllegalArgumentException(type + " order requires a stopPrice");
		}
	}

	public static OrderRequest market(String symbol, OrderSide side, BigDecimal quantity, String clientOrderId) {
		return new OrderRequest(symbol, side, OrderType.MARKET, quantity, null, null, false, clientOrderId);
	}

	public static OrderRequest limit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price,
			String clientOrderId) {
		return new OrderRequest(symbol, side, OrderType.LIMIT, quantity, price, null, false, clientOrderId);
	}

	public static OrderRequest reduceOnlyMarket(String symbol, OrderSide side, BigDecimal quantity) {
		return new OrderRequest(symbol, side, OrderType.MARKET, quantity, null, null, true, null);
	}

	public static OrderRequest stopMarket(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice) {
		return new OrderRequest(symbol, side, OrderType.STOP_MARKET, quantity, null, stopPrice, true, null);
	}

	public static OrderRequest takeProfitMarket(String symbol, OrderSide side, BigDecimal quantity,
			BigDecimal stopPrice) {
		return new OrderRequest(symbol, side, OrderType.TAKE_PROFIT_MARKET, quantity, null, stopPrice, true, null);
	}
}
