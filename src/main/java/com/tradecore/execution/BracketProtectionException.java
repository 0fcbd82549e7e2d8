package com.tradecore.execution;

/**
 * A stop-loss / take-profit pair could not be placed completely.
 */
public class BracketProtectionException extends RuntimeException {

	private final String symbol;

	public BracketProtectionException(String symbol, String message, Throwable cause) {
		super(message, cause);
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
