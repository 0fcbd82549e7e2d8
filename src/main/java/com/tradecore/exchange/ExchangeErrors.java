package com.tradecore.exchange;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.springframework.web.reactive.function.client.WebClientRequestException;

/**
 * Classifies failures coming out of the exchange transport.
 */
public final class ExchangeErrors {

	private ExchangeErrors() {
	}

	/**
	 * Network-level or server-side failures that say nothing about the request itself and may
	 * succeed on retry.
	 */
	public static boolean isTransient(Throwable error) {
		if (error instanceof BinanceApiException exception) {
			return exception.httpStatus() >= 500 || exception.httpStatus() == 429;
		}
		return error instanceof WebClientRequestException
				|| error instanceof TimeoutException
				|| error instanceof IOException
				|| (error != null && error.getCause() instanceof IOException);
	}

	/**
	 * "Unknown order" on cancel (-2011) or "order does not exist" on query (-2013). On cancel it
	 * only says the order left the book, which includes having filled.
	 */
	public static boolean isUnknownOrder(Throwable error) {
		return error instanceof BinanceApiException exception && exception.isUnknownOrder();
	}

	/**
	 * Reduce-only order rejected because there is no position left to reduce.
	 */
	public static boolean isReduceOnlyRejected(Throwable error) {
		return error instanceof BinanceApiException exception && exception.isReduceOnlyRejected();
	}

	public static String describe(Throwable error) {
		if (error == null) {
			return "NA";
		}
		return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
	}
}
