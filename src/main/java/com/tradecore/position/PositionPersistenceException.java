package com.tradecore.position;

public class PositionPersistenceException extends RuntimeException {

	public PositionPersistenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
