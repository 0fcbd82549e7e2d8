package com.tradecore.exchange;

/**
 * A request the exchange answered with an error status. {@code code} is Binance's error code
 * from the response body, when one could be parsed.
 */
public class BinanceApiException extends RuntimeException {

	public static final int TIMESTAMP_OUTSIDE_RECV_WINDOW = -1021;
	public static final int UNKNOWN_ORDER = -2011;
	public static final int ORDER_DOES_NOT_EXIST = -2013;
	public static final int REDUCE_ONLY_REJECTED = -2022;
	public static final int NO_NEED_TO_CHANGE_MARGIN_TYPE = -4046;

	private final Integer code;
	private final int httpStatus;

	public BinanceApiException(Integer code, int httpStatus, String message) {
		super(message);
		this.code = code;
		this.httpStatus = httpStatus;
	}

	public Integer code() {
		return code;
	}

	public int httpStatus() {
		return httpStatus;
	}

	public boolean isTimestampError() {
		return code != null && code == TIMESTAMP_OUTSIDE_RECV_WINDOW;
	}

	public boolean isUnknownOrder() {
		return code != null && (code == UNKNOWN_ORDER || code == ORDER_DOES_NOT_EXIST);
	}

	public boolean isReduceOnlyRejected() {
		return code != null && code == REDUCE_ONLY_REJECTED;
	}
}
