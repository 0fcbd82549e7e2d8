package com.tradecore.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.tradecore.exchange.dto.OrderRequest;
import com.tradecore.exchange.dto.OrderSide;
import com.tradecore.exchange.dto.SymbolRules;

class BinanceFuturesGatewayTest {

	@Test
	void resolvesRulesFromExchangeFilters() {
		BinanceFuturesGateway.ExchangeFilter lotSize = new BinanceFuturesGateway.ExchangeFilter(
				"LOT_SIZE",
				new BigDecimal("0.001"),
				new BigDecimal("0.001"),
				null);
		BinanceFuturesGateway.ExchangeFilter priceFilter = new BinanceFuturesGateway.ExchangeFilter(
				"PRICE_FILTER",
				null,
				null,
				new BigDecimal("0.10"));
		BinanceFuturesGateway.ExchangeFilter marketLot = new BinanceFuturesGateway.ExchangeFilter(
				"MARKET_LOT_SIZE",
				new BigDecimal("1"),
				new BigDecimal("1"),
				null);

		SymbolRules rules = BinanceFuturesGateway.resolveSymbolRules(new BinanceFuturesGateway.SymbolInfo(
				"BTCUSDT", 2, 3, List.of(lotSize, priceFilter, marketLot)));

		assertEquals("BTCUSDT", rules.symbol());
		assertThat(rules.priceTick()).isEqualByComparingTo("0.1");
		assertThat(rules.quantityStep()).isEqualByComparingTo("0.001");
		assertThat(rules.minQuantity()).isEqualByComparingTo("0.001");
		assertEquals(2, rules.pricePrecision());
		assertEquals(3, rules.quantityPrecision());
	}

	@Test
	void limitPayloadCarriesPriceAndTimeInForce() {
		String payload = BinanceFuturesGateway.orderPayload(
				OrderRequest.limit("BTCUSDT", OrderSide.BUY, new BigDecimal("0.010"), new BigDecimal("65000.1"), "tc_e_1"),
				"tc_e_1");

		assertEquals("symbol=BTCUSDT&side=BUY&type=LIMIT&quantity=0.010&price=65000.1&timeInForce=GTC"
				+ "&newClientOrderId=tc_e_1", payload);
	}

	@Test
	void bracketPayloadIsReduceOnlyOnMarkPrice() {
		String payload = BinanceFuturesGateway.orderPayload(
				OrderRequest.stopMarket("BTCUSDT", OrderSide.SELL, new BigDecimal("0.01"), new BigDecimal("1E+4")),
				"abc");

		assertThat(payload)
				.contains("type=STOP_MARKET")
				.contains("stopPrice=10000")
				.contains("workingType=MARK_PRICE")
				.contains("reduceOnly=true")
				.doesNotContain("price=1")
				.doesNotContain("timeInForce");
	}

	@Test
	void extractsErrorCodeFromBody() {
		assertEquals(-2011, BinanceFuturesGateway.extractCode("{\"code\": -2011, \"msg\":\"Unknown order sent.\"}"));
		assertNull(BinanceFuturesGateway.extractCode("<html>bad gateway</html>"));
		assertNull(BinanceFuturesGateway.extractCode(null));
	}

	@Test
	void rejectedReduceOnlyIsRecognised() {
		BinanceApiException exception = BinanceFuturesGateway.toBinanceException("Binance order failed", 400,
				"{\"code\":-2022,\"msg\":\"ReduceOnly Order is rejected.\"}");

		assertTrue(exception.isReduceOnlyRejected());
		assertTrue(ExchangeErrors.isReduceOnlyRejected(exception));
		assertEquals(400, exception.httpStatus());
		assertThat(exception.getMessage()).startsWith("Binance order failed with status=400");
	}

	@Test
	void serverErrorsAreTransientClientErrorsAreNot() {
		assertTrue(ExchangeErrors.isTransient(new BinanceApiException(null, 503, "unavailable")));
		assertTrue(ExchangeErrors.isTransient(new BinanceApiException(-1003, 429, "too many requests")));
		assertThat(ExchangeErrors.isTransient(new BinanceApiException(-2019, 400, "margin"))).isFalse();
	}
}
