package com.tradecore.exchange;

import java.math.BigDecimal;
import java.util.List;

import com.tradecore.exchange.dto.ExchangePosition;
import com.tradecore.exchange.dto.MarginType;
import com.tradecore.exchange.dto.OrderRequest;
import com.tradecore.exchange.dto.OrderResponse;
import com.tradecore.exchange.dto.SymbolRules;
import com.tradecore.market.dto.OrderBookDepthResponse;

import reactor.core.publisher.Mono;

/**
 * REST side of the futures exchange. Every call is asynchronous; failures surface as
 * {@link BinanceApiException} for rejected requests and as transport exceptions otherwise
 * (see {@link ExchangeErrors}).
 */
public interface ExchangeGateway {

	Mono<OrderBookDepthResponse> getOrderBookSnapshot(String symbol, int depth);

	Mono<OrderResponse> createOrder(OrderRequest request);

	Mono<OrderResponse> getOrder(String symbol, long orderId);

	Mono<Void> cancelOrder(String symbol, long orderId);

	Mono<Void> cancelAllOpenOrders(String symbol);

	Mono<BigDecimal> getAccountBalance(String asset);

	/**
	 * Positions with a non-zero amount only.
	 */
	Mono<List<ExchangePosition>> getOpenPositions();

	Mono<SymbolRules> getSymbolRules(String symbol);

	Mono<Void> changeLeverage(String symbol, int leverage);

	Mono<Void> changeMarginType(String symbol, MarginType marginType);

	Mono<String> startUserDataStream();

	Mono<Void> keepAliveUserDataStream(String listenKey);
}
