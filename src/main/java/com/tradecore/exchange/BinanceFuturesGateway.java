package com.tradecore.exchange;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.tradecore.config.BinanceProperties;
import com.tradecore.exchange.dto.ExchangePosition;
import com.tradecore.exchange.dto.MarginType;
import com.tradecore.exchange.dto.OrderRequest;
import com.tradecore.exchange.dto.OrderResponse;
import com.tradecore.exchange.dto.OrderType;
import com.tradecore.exchange.dto.SymbolRules;
import com.tradecore.market.dto.OrderBookDepthResponse;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

@Component
public class BinanceFuturesGateway implements ExchangeGateway {

	private static final Logger LOGGER = LoggerFactory.getLogger(BinanceFuturesGateway.class);
	private static final Pattern BINANCE_CODE_PATTERN = Pattern.compile("\"code\"\\s*:\\s*(-?\\d+)");
	private static final Retry TRANSIENT_RETRY = Retry.backoff(2, Duration.ofMillis(200))
			.filter(ExchangeErrors::isTransient);

	private final WebClient binanceWebClient;
	private final BinanceProperties properties;
	private final RequestSigner requestSigner;

	public BinanceFuturesGateway(WebClient binanceWebClient, BinanceProperties properties,
			RequestSigner requestSigner) {
		this.binanceWebClient = binanceWebClient;
		this.properties = properties;
		this.requestSigner = requestSigner;
	}

	@Override
	public Mono<OrderBookDepthResponse> getOrderBookSnapshot(String symbol, int depth) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/depth")
						.queryParam("symbol", symbol)
						.queryParam("limit", depth)
						.build())
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(toBinanceException("Binance depth snapshot failed",
								response.statusCode().value(), body))))
				.bodyToMono(OrderBookDepthResponse.class)
				.retryWhen(TRANSIENT_RETRY);
	}

	@Override
	public Mono<OrderResponse> createOrder(OrderRequest request) {
		String clientOrderId = request.clientOrderId() == null || request.clientOrderId().isBlank()
				? UUID.randomUUID().toString()
				: request.clientOrderId();
		return signed(HttpMethod.POST, "/fapi/v1/order", "Binance order failed",
				() -> orderPayload(request, clientOrderId), OrderResponse.class)
				.doOnNext(response -> LOGGER.info(
						"EVENT=ORDER_SUBMITTED symbol={} side={} type={} qty={} price={} stopPrice={} reduceOnly={} clientOrderId={} orderId={} status={}",
						request.symbol(), request.side(), request.type(), request.quantity().toPlainString(),
						request.price() == null ? "NA" : request.price().toPlainString(),
						request.stopPrice() == null ? "NA" : request.stopPrice().toPlainString(),
						request.reduceOnly(), clientOrderId, response.orderId(), response.status()));
	}

	@Override
	public Mono<OrderResponse> getOrder(String symbol, long orderId) {
		return signed(HttpMethod.GET, "/fapi/v1/order", "Binance order fetch failed",
				() -> "symbol=" + symbol + "&orderId=" + orderId, OrderResponse.class)
				.retryWhen(TRANSIENT_RETRY);
	}

	@Override
	public Mono<Void> cancelOrder(String symbol, long orderId) {
		return signed(HttpMethod.DELETE, "/fapi/v1/order", "Binance cancel failed",
				() -> "symbol=" + symbol + "&orderId=" + orderId, String.class)
				.retryWhen(TRANSIENT_RETRY)
				.then();
	}

	@Override
	public Mono<Void> cancelAllOpenOrders(String symbol) {
		return signed(HttpMethod.DELETE, "/fapi/v1/allOpenOrders", "Binance cancel-all failed",
				() -> "symbol=" + symbol, String.class)
				.retryWhen(TRANSIENT_RETRY)
				.then();
	}

	@Override
	public Mono<BigDecimal> getAccountBalance(String asset) {
		return signed(HttpMethod.GET, "/fapi/v2/balance", "Binance balance fetch failed", () -> "",
				BalanceResponse[].class)
				.retryWhen(TRANSIENT_RETRY)
				.map(balances -> {
					for (BalanceResponse balance : balances) {
						if (asset.equalsIgnoreCase(balance.asset())) {
							return balance.availableBalance() != null ? balance.availableBalance()
									: balance.balance();
						}
					}
					return BigDecimal.ZERO;
				});
	}

	@Override
	public Mono<List<ExchangePosition>> getOpenPositions() {
		return signed(HttpMethod.GET, "/fapi/v2/positionRisk", "Binance position fetch failed", () -> "",
				PositionRiskResponse[].class)
				.retryWhen(TRANSIENT_RETRY)
				.map(positions -> Arrays.stream(positions)
						.filter(position -> position.positionAmt() != null && position.positionAmt().signum() != 0)
						.map(position -> new ExchangePosition(
								position.symbol(),
								position.positionAmt(),
								position.entryPrice(),
								position.leverage() == null ? 0 : position.leverage()))
						.toList());
	}

	@Override
	public Mono<SymbolRules> getSymbolRules(String symbol) {
		return fetchExchangeInfo()
				.flatMap(response -> response.symbols().stream()
						.filter(info -> symbol.equalsIgnoreCase(info.symbol()))
						.findFirst()
						.map(info -> Mono.just(resolveSymbolRules(info)))
						.orElseGet(() -> Mono.error(new IllegalArgumentException("Symbol not found: " + symbol))));
	}

	@Override
	public Mono<Void> changeLeverage(String symbol, int leverage) {
		return signed(HttpMethod.POST, "/fapi/v1/leverage", "Binance leverage change failed",
				() -> "symbol=" + symbol + "&leverage=" + leverage, String.class)
				.doOnNext(ignored -> LOGGER.info("EVENT=LEVERAGE_SET symbol={} leverage={}", symbol, leverage))
				.then();
	}

	@Override
	public Mono<Void> changeMarginType(String symbol, MarginType marginType) {
		return signed(HttpMethod.POST, "/fapi/v1/marginType", "Binance margin type change failed",
				() -> "symbol=" + symbol + "&marginType=" + marginType.name(), String.class)
				.doOnNext(ignored -> LOGGER.info("EVENT=MARGIN_TYPE_SET symbol={} marginType={}", symbol, marginType))
				.then()
				.onErrorResume(error -> error instanceof BinanceApiException exception
						&& exception.code() != null
						&& exception.code() == BinanceApiException.NO_NEED_TO_CHANGE_MARGIN_TYPE,
						error -> {
							LOGGER.debug("EVENT=MARGIN_TYPE_UNCHANGED symbol={} marginType={}", symbol, marginType);
							return Mono.empty();
						});
	}

	@Override
	public Mono<String> startUserDataStream() {
		if (properties.apiKey() == null || properties.apiKey().isBlank()) {
			return Mono.error(new IllegalStateException("Binance API key is not configured."));
		}
		return binanceWebClient
				.post()
				.uri("/fapi/v1/listenKey")
				.header("X-MBX-APIKEY", properties.apiKey())
				.retrieve()
				.bodyToMono(ListenKeyResponse.class)
				.map(ListenKeyResponse::listenKey);
	}

	@Override
	public Mono<Void> keepAliveUserDataStream(String listenKey) {
		if (properties.apiKey() == null || properties.apiKey().isBlank()) {
			return Mono.error(new IllegalStateException("Binance API key is not configured."));
		}
		return binanceWebClient
				.put()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/listenKey")
						.queryParam("listenKey", listenKey)
						.build())
				.header("X-MBX-APIKEY", properties.apiKey())
				.retrieve()
				.bodyToMono(Void.class);
	}

	public Mono<ExchangeInfoResponse> fetchExchangeInfo() {
		return binanceWebClient
				.get()
				.uri("/fapi/v1/exchangeInfo")
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(toBinanceException("Binance exchange info failed",
								response.statusCode().value(), body))))
				.bodyToMono(ExchangeInfoResponse.class)
				.retryWhen(TRANSIENT_RETRY);
	}

	public static SymbolRules resolveSymbolRules(SymbolInfo info) {
		BigDecimal tickSize = null;
		BigDecimal stepSize = null;
		BigDecimal minQty = null;
		if (info.filters() != null) {
			for (ExchangeFilter filter : info.filters()) {
				if ("PRICE_FILTER".equalsIgnoreCase(filter.filterType())) {
					tickSize = filter.tickSize();
				}
				if ("LOT_SIZE".equalsIgnoreCase(filter.filterType())) {
					stepSize = filter.stepSize();
					minQty = filter.minQty();
				}
			}
		}
		return new SymbolRules(info.symbol(), tickSize, stepSize, info.pricePrecision(), info.quantityPrecision(),
				minQty);
	}

	static String orderPayload(OrderRequest request, String clientOrderId) {
		StringBuilder payload = new StringBuilder()
				.append("symbol=").append(request.symbol())
				.append("&side=").append(request.side().name())
				.append("&type=").append(request.type().name())
				.append("&quantity=").append(request.quantity().toPlainString());
		if (request.type() == OrderType.LIMIT) {
			payload.append("&price=").append(request.price().toPlainString())
					.append("&timeInForce=GTC");
		}
		if (request.stopPrice() != null) {
			payload.append("&stopPrice=").append(request.stopPrice().toPlainString())
					.append("&workingType=MARK_PRICE");
		}
		if (request.reduceOnly()) {
			payload.append("&reduceOnly=true");
		}
		payload.append("&newClientOrderId=").append(clientOrderId);
		return payload.toString();
	}

	private <T> Mono<T> signed(HttpMethod method, String path, String failurePrefix, Supplier<String> paramsSupplier,
			Class<T> responseType) {
		if (!properties.hasCredentials()) {
			return Mono.error(new IllegalStateException(
					"Binance API key/secret is not configured. Set BINANCE_API_KEY and BINANCE_SECRET_KEY."));
		}
		return withTimestampRetry(() -> {
			String signedPayload = requestSigner.signedQuery(paramsSupplier.get());
			return binanceWebClient
					.method(method)
					.uri(uriBuilder -> uriBuilder
							.path(path)
							.query(signedPayload)
							.build())
					.header(HttpHeaders.CONTENT_TYPE, "application/x-www-form-urlencoded")
					.header("X-MBX-APIKEY", properties.apiKey())
					.retrieve()
					.onStatus(status -> status.isError(), response -> response
							.bodyToMono(String.class)
							.defaultIfEmpty("<empty>")
							.flatMap(body -> Mono.error(toBinanceException(failurePrefix,
									response.statusCode().value(), body))))
					.bodyToMono(responseType);
		});
	}

	private <T> Mono<T> withTimestampRetry(Supplier<Mono<T>> requestSupplier) {
		return Mono.defer(requestSupplier)
				.onErrorResume(error -> {
					if (!(error instanceof BinanceApiException exception) || !exception.isTimestampError()) {
						return Mono.error(error);
					}
					return requestSigner.resync()
							.then(Mono.defer(requestSupplier));
				});
	}

	static BinanceApiException toBinanceException(String prefix, int status, String body) {
		return new BinanceApiException(extractCode(body), status,
				prefix + " with status=" + status + ", body=" + body);
	}

	static Integer extractCode(String body) {
		if (body == null) {
			return null;
		}
		Matcher matcher = BINANCE_CODE_PATTERN.matcher(body);
		if (!matcher.find()) {
			return null;
		}
		try {
			return Integer.parseInt(matcher.group(1));
		} catch (NumberFormatException ignored) {
			return null;
		}
	}

	private record BalanceResponse(String asset, BigDecimal balance, BigDecimal availableBalance) {
	}

	private record PositionRiskResponse(
			String symbol,
			BigDecimal positionAmt,
			BigDecimal entryPrice,
			Integer leverage) {
	}

	private record ListenKeyResponse(String listenKey) {
	}

	public record ExchangeInfoResponse(List<SymbolInfo> symbols) {
	}

	public record SymbolInfo(
			String symbol,
			int pricePrecision,
			int quantityPrecision,
			List<ExchangeFilter> filters) {
	}

	public record ExchangeFilter(
			String filterType,
			BigDecimal minQty,
			BigDecimal stepSize,
			BigDecimal tickSize) {
	}
}
